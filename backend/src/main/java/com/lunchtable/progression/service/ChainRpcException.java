package com.lunchtable.progression.service;

/**
 * Transport-level failure talking to the chain RPC node. Retryable.
 */
public class ChainRpcException extends Exception {

    public ChainRpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
