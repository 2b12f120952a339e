package com.confectionery.distribution.service;

import java.math.BigDecimal;

/**
 * A requested movement of one product. Request records implement this so the
 * ledger can validate and aggregate them uniformly.
 */
public interface LedgerLine {

    Long productId();

    Integer quantity();

    default BigDecimal price() {
        return null;
    }
}
