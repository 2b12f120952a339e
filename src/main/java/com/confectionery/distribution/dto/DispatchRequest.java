package com.confectionery.distribution.dto;

import java.util.List;

public record DispatchRequest(Long managerId, List<DispatchLine> items) {
}
