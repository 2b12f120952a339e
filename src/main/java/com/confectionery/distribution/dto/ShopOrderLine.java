package com.confectionery.distribution.dto;

import com.confectionery.distribution.service.LedgerLine;

import java.math.BigDecimal;

/**
 * One delivered line. {@code price} may be null, in which case the manager's
 * live price applies.
 */
public record ShopOrderLine(Long productId, Integer quantity, BigDecimal price, boolean bonus) implements LedgerLine {
}
