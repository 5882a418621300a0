package com.lunchtable.progression.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.OffsetDateTime;

@RestControllerAdvice
public class ProgressionExceptionHandler {

    @ExceptionHandler(ProgressionException.class)
    public ResponseEntity<ProgressionErrorResponse> handle(ProgressionException ex) {
        return ResponseEntity
                .status(ex.getStatus())
                .body(new ProgressionErrorResponse(ex.getCode(), ex.getMessage(), ex.getResetAt()));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ProgressionErrorResponse(
            String code,
            String message,
            OffsetDateTime resetAt
    ) {
    }
}
