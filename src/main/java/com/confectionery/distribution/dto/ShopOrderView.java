package com.confectionery.distribution.dto;

import com.confectionery.distribution.model.ShopOrder;
import com.confectionery.distribution.model.ShopOrderPayment;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

public record ShopOrderView(
        Long id,
        Long managerId,
        Long shopId,
        String shopName,
        LocalDateTime createdAt,
        List<Line> items,
        Payment payment) {

    public record Line(Long productId, String productName, int quantity, BigDecimal price, boolean bonus) {
    }

    public record Payment(
            BigDecimal goodsTotal,
            BigDecimal bonusTotal,
            BigDecimal returnsAmount,
            BigDecimal payableAmount,
            BigDecimal paidAmount,
            BigDecimal debtAmount) {
    }

    public static ShopOrderView from(ShopOrder order) {
        List<Line> lines = order.getItems().stream()
                .map(i -> new Line(i.getProduct().getId(), i.getProduct().getName(), i.getQuantity(), i.getPrice(),
                        i.isBonus()))
                .toList();
        ShopOrderPayment p = order.getPayment();
        Payment payment = p == null ? null
                : new Payment(p.getGoodsTotal(), p.getBonusTotal(), p.getReturnsAmount(), p.getPayableAmount(),
                        p.getPaidAmount(), p.getDebtAmount());
        return new ShopOrderView(
                order.getId(),
                order.getManager().getId(),
                order.getShop().getId(),
                order.getShop().getName(),
                order.getCreatedAt(),
                lines,
                payment);
    }
}
