package com.confectionery.distribution.model;

public enum UserRole {
    ADMIN,
    MANAGER
}
