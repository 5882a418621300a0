package com.lunchtable.progression.service;

/**
 * The chain could not be read. The cache row stays marked stale and the refresh task is retried.
 */
public class TokenBalanceRefreshException extends RuntimeException {

    public TokenBalanceRefreshException(String message, Throwable cause) {
        super(message, cause);
    }
}
