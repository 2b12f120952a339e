package com.confectionery.distribution.dto;

import java.math.BigDecimal;

// Null fields are left unchanged
public record ProductUpdateRequest(String name, BigDecimal price, Boolean archived) {
}
