package com.geonews.api.model;

import java.time.Instant;

public record ErrorResponse(String error, String detail, Instant timestamp) {

    public static ErrorResponse of(String error, String detail) {
        return new ErrorResponse(error, detail, Instant.now());
    }
}
