package com.confectionery.distribution.dto;

import java.util.List;

public record IncomingRequest(List<IncomingLine> items) {
}
