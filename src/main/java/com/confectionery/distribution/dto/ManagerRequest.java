package com.confectionery.distribution.dto;

public record ManagerRequest(String username, String password, String fullName, Boolean active) {
}
