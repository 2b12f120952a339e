package com.confectionery.distribution.dto;

import com.confectionery.distribution.model.Incoming;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

public record IncomingView(Long id, Long createdById, LocalDateTime createdAt, List<Line> items) {

    public record Line(Long productId, String productName, int quantity, BigDecimal priceAtTime) {
    }

    public static IncomingView from(Incoming incoming) {
        List<Line> lines = incoming.getItems().stream()
                .map(i -> new Line(i.getProduct().getId(), i.getProduct().getName(), i.getQuantity(),
                        i.getPriceAtTime()))
                .toList();
        return new IncomingView(incoming.getId(), incoming.getCreatedBy().getId(), incoming.getCreatedAt(), lines);
    }
}
