package com.confectionery.distribution.service;

import java.math.BigDecimal;

/**
 * Total required quantity of one product within a single request.
 */
public record AggregatedLine(Long productId, Integer quantity, BigDecimal price) implements LedgerLine {

    AggregatedLine merge(LedgerLine next) {
        BigDecimal mergedPrice = next.price() != null ? next.price() : price;
        return new AggregatedLine(productId, Math.addExact(quantity, next.quantity()), mergedPrice);
    }
}
