package com.confectionery.distribution.dto;

import com.confectionery.distribution.model.Dispatch;
import com.confectionery.distribution.model.DispatchStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;

public record DispatchView(
        Long id,
        Long managerId,
        String managerName,
        DispatchStatus status,
        LocalDateTime createdAt,
        LocalDateTime acceptedAt,
        List<Line> items) {

    public record Line(Long productId, String productName, int quantity, BigDecimal price) {
    }

    // Lines carry the product's current name, sorted the way the dispatch sheet is printed
    public static DispatchView from(Dispatch dispatch) {
        List<Line> lines = dispatch.getItems().stream()
                .map(i -> new Line(i.getProduct().getId(), i.getProduct().getName(), i.getQuantity(), i.getPrice()))
                .sorted(Comparator.comparing(Line::productName))
                .toList();
        return new DispatchView(
                dispatch.getId(),
                dispatch.getManager().getId(),
                dispatch.getManager().getDisplayName(),
                dispatch.getStatus(),
                dispatch.getCreatedAt(),
                dispatch.getAcceptedAt(),
                lines);
    }
}
