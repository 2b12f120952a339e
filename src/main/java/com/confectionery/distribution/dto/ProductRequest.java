package com.confectionery.distribution.dto;

import java.math.BigDecimal;

/**
 * New catalog product; {@code quantity} opens its pool balance.
 */
public record ProductRequest(String name, BigDecimal price, Integer quantity) {
}
