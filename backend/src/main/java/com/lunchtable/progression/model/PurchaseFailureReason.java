package com.lunchtable.progression.model;

public enum PurchaseFailureReason {
    TIMEOUT,
    NO_SIGNATURE,
    CHAIN_ERROR,
    RPC_ERROR,
    SIGNATURE_EXPIRED,
    CANCELLED
}
