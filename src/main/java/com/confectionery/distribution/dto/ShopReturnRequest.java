package com.confectionery.distribution.dto;

import java.util.List;

public record ShopReturnRequest(Long shopId, List<ReturnLine> items) {
}
