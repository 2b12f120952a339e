package com.confectionery.distribution.dto;

public record ManagerUpdateRequest(String fullName, String password, Boolean active) {
}
