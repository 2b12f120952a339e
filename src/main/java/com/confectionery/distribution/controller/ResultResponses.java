package com.confectionery.distribution.controller;

import com.confectionery.distribution.dto.ErrorResponse;
import com.confectionery.distribution.service.ErrorKind;
import com.confectionery.distribution.service.TransferResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Maps service results onto HTTP responses.
 */
final class ResultResponses {

    private ResultResponses() {
    }

    static ResponseEntity<Object> ok(TransferResult<?> result) {
        return respond(result, HttpStatus.OK);
    }

    static ResponseEntity<Object> created(TransferResult<?> result) {
        return respond(result, HttpStatus.CREATED);
    }

    static HttpStatus statusOf(ErrorKind error) {
        switch (error) {
            case VALIDATION:
                return HttpStatus.BAD_REQUEST;
            case FORBIDDEN:
                return HttpStatus.FORBIDDEN;
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case CONFLICT:
            case DATA_INTEGRITY:
                return HttpStatus.CONFLICT;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    private static ResponseEntity<Object> respond(TransferResult<?> result, HttpStatus successStatus) {
        if (result.isSuccess()) {
            return ResponseEntity.status(successStatus).body(result.getValue());
        }
        return ResponseEntity.status(statusOf(result.getError()))
                .body(new ErrorResponse(result.getError(), result.getMessage(), result.getShortages()));
    }
}
