package com.lunchtable.progression.web;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.time.OffsetDateTime;

/**
 * Caller-facing failure of a progression operation. The code is stable and safe to branch on.
 */
@Getter
public class ProgressionException extends RuntimeException {

    private final HttpStatus status;
    private final String code;
    private final OffsetDateTime resetAt;

    public ProgressionException(HttpStatus status, String code, String message) {
        this(status, code, message, null);
    }

    public ProgressionException(HttpStatus status, String code, String message, OffsetDateTime resetAt) {
        super(message);
        this.status = status;
        this.code = code;
        this.resetAt = resetAt;
    }

    public static ProgressionException validation(String code, String detail) {
        return new ProgressionException(HttpStatus.BAD_REQUEST, code, detail);
    }

    public static ProgressionException forbidden(String detail) {
        return new ProgressionException(HttpStatus.FORBIDDEN, "forbidden", detail);
    }

    public static ProgressionException notFound(String code, String detail) {
        return new ProgressionException(HttpStatus.NOT_FOUND, code, detail);
    }

    public static ProgressionException conflict(String code, String detail) {
        return new ProgressionException(HttpStatus.CONFLICT, code, detail);
    }

    public static ProgressionException unavailable(String code, String detail) {
        return new ProgressionException(HttpStatus.SERVICE_UNAVAILABLE, code, detail);
    }

    public static ProgressionException rateLimited(String detail, OffsetDateTime resetAt) {
        return new ProgressionException(HttpStatus.TOO_MANY_REQUESTS, "rate_limited", detail, resetAt);
    }
}
