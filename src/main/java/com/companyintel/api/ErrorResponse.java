package com.companyintel.api;

import java.time.Instant;

public record ErrorResponse(boolean success, String error, String errorCode, Instant timestamp) {

    public static ErrorResponse of(String error, String errorCode) {
        return new ErrorResponse(false, error, errorCode, Instant.now());
    }
}
