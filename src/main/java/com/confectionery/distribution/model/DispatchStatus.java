package com.confectionery.distribution.model;

public enum DispatchStatus {
    PENDING,
    SENT
}
