package com.confectionery.distribution.dto;

import com.confectionery.distribution.service.LedgerLine;

import java.math.BigDecimal;

public record IncomingLine(Long productId, Integer quantity, BigDecimal price) implements LedgerLine {
}
