package com.lunchtable.progression.service;

import java.util.Locale;

/**
 * Commitment levels reported by the RPC node, weakest first.
 */
public enum ConfirmationLevel {
    PROCESSED,
    CONFIRMED,
    FINALIZED;

    public static ConfirmationLevel parse(String value) {
        if (value == null || value.isBlank()) {
            return PROCESSED;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "finalized" -> FINALIZED;
            case "confirmed" -> CONFIRMED;
            case "processed" -> PROCESSED;
            default -> throw new IllegalArgumentException("Unknown confirmation level: " + value);
        };
    }

    public boolean meets(ConfirmationLevel required) {
        return compareTo(required) >= 0;
    }
}
