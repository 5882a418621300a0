package com.lunchtable.progression.service;

/**
 * Chain view of a submitted transaction signature.
 *
 * @param found              whether the node knows the signature at all
 * @param error              execution error reported by the chain, or null when the transfer succeeded
 * @param confirmationStatus processed, confirmed or finalized
 * @param confirmations      confirmation count, null once finalized
 */
public record SignatureStatus(
        boolean found,
        String error,
        String confirmationStatus,
        Long confirmations
) {
    public static SignatureStatus notFound() {
        return new SignatureStatus(false, null, null, null);
    }

    public boolean failed() {
        return found && error != null;
    }
}
