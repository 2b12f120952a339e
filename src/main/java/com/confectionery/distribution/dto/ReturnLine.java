package com.confectionery.distribution.dto;

import com.confectionery.distribution.service.LedgerLine;

public record ReturnLine(Long productId, Integer quantity) implements LedgerLine {
}
