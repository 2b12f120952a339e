package com.confectionery.distribution.dto;

import java.math.BigDecimal;
import java.util.List;

public record ShopOrderRequest(
        Long shopId,
        List<ShopOrderLine> items,
        BigDecimal returnsAmount,
        BigDecimal paidAmount) {
}
