package com.example.progress.shared.dto;

import lombok.Value;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * JSON body of every REST error. {@code error} is the short reason phrase, {@code message} the
 * detail a client can show, {@code path} the request path that failed.
 */
@Value
public class ErrorResponse {
    OffsetDateTime timestamp;
    int status;
    String error;
    String message;
    String path;

    public static ErrorResponse of(int status, String error, String message, String path) {
        return new ErrorResponse(OffsetDateTime.now(ZoneOffset.UTC), status, error, message, path);
    }
}
