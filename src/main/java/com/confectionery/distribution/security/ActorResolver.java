package com.confectionery.distribution.security;

import com.confectionery.distribution.repository.UserRepository;
import org.springframework.security.authentication.InsufficientAuthenticationException;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Component;

@Component
public class ActorResolver {

    private final UserRepository userRepository;

    public ActorResolver(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    public Actor resolve(Authentication authentication) {
        if (authentication == null || !authentication.isAuthenticated()) {
            throw new InsufficientAuthenticationException("Authentication required");
        }
        return userRepository.findByUsername(authentication.getName())
                .filter(u -> u.isActive())
                .map(Actor::of)
                .orElseThrow(() -> new InsufficientAuthenticationException(
                        "Unknown or inactive user: " + authentication.getName()));
    }
}
