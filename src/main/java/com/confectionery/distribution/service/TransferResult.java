package com.confectionery.distribution.service;

import java.util.List;

/**
 * Outcome of a ledger operation: either the composed document or an error kind
 * with a message. Insufficient stock is a {@link ErrorKind#CONFLICT} carrying
 * every short product.
 */
public final class TransferResult<T> {

    private final T value;
    private final ErrorKind error;
    private final String message;
    private final List<Shortage> shortages;

    private TransferResult(T value, ErrorKind error, String message, List<Shortage> shortages) {
        this.value = value;
        this.error = error;
        this.message = message;
        this.shortages = shortages;
    }

    public static <T> TransferResult<T> ok(T value) {
        return new TransferResult<>(value, null, null, List.of());
    }

    public static <T> TransferResult<T> failure(ErrorKind error, String message) {
        return new TransferResult<>(null, error, message, List.of());
    }

    public static <T> TransferResult<T> validation(String message) {
        return failure(ErrorKind.VALIDATION, message);
    }

    public static <T> TransferResult<T> forbidden(String message) {
        return failure(ErrorKind.FORBIDDEN, message);
    }

    public static <T> TransferResult<T> notFound(String message) {
        return failure(ErrorKind.NOT_FOUND, message);
    }

    public static <T> TransferResult<T> conflict(String message) {
        return failure(ErrorKind.CONFLICT, message);
    }

    public static <T> TransferResult<T> insufficientStock(List<Shortage> shortages) {
        return new TransferResult<>(null, ErrorKind.CONFLICT, "Insufficient stock", List.copyOf(shortages));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public T getValue() {
        if (!isSuccess()) {
            throw new IllegalStateException("No value on failed result: " + error + " " + message);
        }
        return value;
    }

    public ErrorKind getError() {
        return error;
    }

    public String getMessage() {
        return message;
    }

    public List<Shortage> getShortages() {
        return shortages;
    }

    @Override
    public String toString() {
        return isSuccess() ? "TransferResult[ok]" : "TransferResult[" + error + ": " + message + "]";
    }
}
