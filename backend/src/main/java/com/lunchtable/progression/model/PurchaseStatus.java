package com.lunchtable.progression.model;

public enum PurchaseStatus {
    AWAITING_SIGNATURE,
    SUBMITTED,
    CONFIRMED,
    FAILED,
    EXPIRED;

    public boolean isTerminal() {
        return this == CONFIRMED || this == FAILED || this == EXPIRED;
    }
}
