package com.confectionery.distribution.security;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;

/**
 * Coarse URL rules only. Ownership (which manager may touch which dispatch or
 * shop) is decided in the services.
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    private static final String ROLE_ADMIN = "ADMIN";
    private static final String ROLE_MANAGER = "MANAGER";

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http) throws Exception {
        http.csrf(csrf -> csrf.disable())
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers("/api/managers/**", "/api/incoming/**").hasRole(ROLE_ADMIN)
                        .requestMatchers(HttpMethod.POST, "/api/products").hasRole(ROLE_ADMIN)
                        .requestMatchers(HttpMethod.PUT, "/api/products/**").hasRole(ROLE_ADMIN)
                        .requestMatchers(HttpMethod.POST, "/api/dispatches").hasRole(ROLE_ADMIN)
                        .requestMatchers(HttpMethod.POST, "/api/dispatches/*/accept").hasRole(ROLE_MANAGER)
                        .requestMatchers(HttpMethod.POST, "/api/shop-orders", "/api/returns/**")
                        .hasRole(ROLE_MANAGER)
                        .requestMatchers("/api/**").authenticated()
                        .anyRequest().denyAll())
                .httpBasic(Customizer.withDefaults());
        return http.build();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }
}
