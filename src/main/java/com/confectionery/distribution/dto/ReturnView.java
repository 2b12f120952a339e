package com.confectionery.distribution.dto;

import com.confectionery.distribution.model.ManagerReturn;
import com.confectionery.distribution.model.ShopReturn;

import java.time.LocalDateTime;
import java.util.List;

public record ReturnView(
        Long id,
        Long managerId,
        Long shopId,
        String shopName,
        boolean fromReturnBin,
        LocalDateTime createdAt,
        List<Line> items) {

    public record Line(Long productId, String productName, int quantity) {
    }

    public static ReturnView from(ShopReturn shopReturn) {
        List<Line> lines = shopReturn.getItems().stream()
                .map(i -> new Line(i.getProduct().getId(), i.getProduct().getName(), i.getQuantity()))
                .toList();
        return new ReturnView(shopReturn.getId(), shopReturn.getManager().getId(), shopReturn.getShop().getId(),
                shopReturn.getShop().getName(), false, shopReturn.getCreatedAt(), lines);
    }

    public static ReturnView from(ManagerReturn managerReturn) {
        List<Line> lines = managerReturn.getItems().stream()
                .map(i -> new Line(i.getProduct().getId(), i.getProduct().getName(), i.getQuantity()))
                .toList();
        return new ReturnView(managerReturn.getId(), managerReturn.getManager().getId(), null, null,
                managerReturn.isFromReturnBin(), managerReturn.getCreatedAt(), lines);
    }
}
