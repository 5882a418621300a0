package com.lunchtable.progression.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.lunchtable.progression.model.RewardTrack;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public final class ProgressionRequests {

    private ProgressionRequests() {
    }

    public record ClaimTierRequest(
            @Min(value = 1, message = "tier must be at least 1")
            int tier,

            @NotNull(message = "track is required")
            RewardTrack track
    ) {
    }

    public record InitiateTokenPurchaseRequest(
            @NotBlank(message = "buyerWallet is required")
            @Size(max = 64, message = "buyerWallet must be at most 64 characters")
            String buyerWallet
    ) {
    }

    public record SubmitSignatureRequest(
            @NotBlank(message = "signature is required")
            @Size(max = 128, message = "signature must be at most 128 characters")
            String signature
    ) {
    }

    /**
     * Raw domain event as produced by the game service.
     */
    public record DomainEventEnvelope(
            @NotBlank(message = "kind is required")
            String kind,

            @NotNull(message = "payload is required")
            JsonNode payload
    ) {
    }
}
