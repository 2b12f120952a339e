package com.confectionery.distribution.security;

import com.confectionery.distribution.model.User;
import com.confectionery.distribution.model.UserRole;

/**
 * Authenticated caller as seen by the ledger services.
 */
public record Actor(Long id, String username, UserRole role) {

    public static Actor of(User user) {
        return new Actor(user.getId(), user.getUsername(), user.getRole());
    }

    public boolean isAdmin() {
        return role == UserRole.ADMIN;
    }

    public boolean isManager() {
        return role == UserRole.MANAGER;
    }
}
