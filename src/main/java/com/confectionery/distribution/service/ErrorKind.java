package com.confectionery.distribution.service;

public enum ErrorKind {
    VALIDATION,
    FORBIDDEN,
    NOT_FOUND,
    CONFLICT,
    DATA_INTEGRITY
}
