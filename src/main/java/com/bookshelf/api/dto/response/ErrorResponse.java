package com.bookshelf.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.List;

/**
 * Uniform error body for every non-2xx response, including the 401 written by the
 * security entry point.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(
    int status,
    String error,
    String message,
    Instant timestamp,
    String path,
    List<FieldError> fieldErrors
) {

    public static ErrorResponse of(HttpStatus status, String message, String path) {
        return of(status, message, path, List.of());
    }

    public static ErrorResponse of(HttpStatus status, String message, String path,
                                   List<FieldError> fieldErrors) {
        return new ErrorResponse(status.value(), status.getReasonPhrase(), message,
                                 Instant.now(), path, fieldErrors);
    }

    public record FieldError(String field, String message) {}
}
