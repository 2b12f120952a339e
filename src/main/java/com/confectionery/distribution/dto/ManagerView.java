package com.confectionery.distribution.dto;

import com.confectionery.distribution.model.User;

import java.time.LocalDateTime;

public record ManagerView(Long id, String username, String fullName, boolean active, LocalDateTime createdAt) {

    public static ManagerView from(User user) {
        return new ManagerView(user.getId(), user.getUsername(), user.getFullName(), user.isActive(),
                user.getCreatedAt());
    }
}
