package com.confectionery.distribution.dto;

public record ShopRequest(String name, String address, String phone, String fridgeNumber) {
}
