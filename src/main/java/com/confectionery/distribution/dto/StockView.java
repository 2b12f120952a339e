package com.confectionery.distribution.dto;

import com.confectionery.distribution.model.StockBalance;

import java.math.BigDecimal;

public record StockView(
        Long balanceId,
        Long productId,
        String productName,
        int quantity,
        BigDecimal price,
        boolean returnBin,
        boolean archived) {

    public static StockView from(StockBalance balance) {
        return new StockView(
                balance.getId(),
                balance.getProduct().getId(),
                balance.getProduct().getName(),
                balance.getQuantity(),
                balance.getPrice(),
                balance.isReturnBin(),
                balance.getProduct().isArchived());
    }
}
