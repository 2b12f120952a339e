package com.confectionery.distribution.dto;

import com.confectionery.distribution.service.ErrorKind;
import com.confectionery.distribution.service.Shortage;

import java.util.List;

public record ErrorResponse(ErrorKind error, String message, List<Shortage> shortages) {

    public static ErrorResponse of(ErrorKind error, String message) {
        return new ErrorResponse(error, message, List.of());
    }
}
