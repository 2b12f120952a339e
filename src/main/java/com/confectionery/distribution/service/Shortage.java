package com.confectionery.distribution.service;

public record Shortage(Long productId, String productName, int requested, int available) {
}
