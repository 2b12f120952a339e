package com.confectionery.distribution.dto;

import com.confectionery.distribution.model.Shop;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record ShopView(
        Long id,
        String name,
        String address,
        String phone,
        String fridgeNumber,
        Long managerId,
        String managerName,
        BigDecimal debt,
        LocalDateTime createdAt) {

    public static ShopView from(Shop shop) {
        return new ShopView(shop.getId(), shop.getName(), shop.getAddress(), shop.getPhone(),
                shop.getFridgeNumber(), shop.getManager().getId(), shop.getManager().getDisplayName(),
                shop.getDebt(), shop.getCreatedAt());
    }
}
