package com.lunchtable.progression.service.scheduling;

import com.fasterxml.jackson.databind.JsonNode;
import com.lunchtable.progression.model.NotificationKind;

import java.util.UUID;

/**
 * Unit of delayed work. Every consumer must tolerate redelivery.
 */
public sealed interface DeferredTask {

    String TYPE_POLL_PURCHASE_CONFIRMATION = "poll_purchase_confirmation";
    String TYPE_DISPATCH_DOMAIN_EVENT = "dispatch_domain_event";
    String TYPE_REFRESH_TOKEN_BALANCE = "refresh_token_balance";
    String TYPE_NOTIFY_PLAYER = "notify_player";

    String taskType();

    record PollPurchaseConfirmation(UUID purchaseId, int attempt, int rpcErrors) implements DeferredTask {
        @Override
        public String taskType() {
            return TYPE_POLL_PURCHASE_CONFIRMATION;
        }
    }

    record DispatchDomainEvent(String kind, JsonNode payload) implements DeferredTask {
        @Override
        public String taskType() {
            return TYPE_DISPATCH_DOMAIN_EVENT;
        }
    }

    record RefreshTokenBalance(String userId, String walletAddress) implements DeferredTask {
        @Override
        public String taskType() {
            return TYPE_REFRESH_TOKEN_BALANCE;
        }
    }

    /**
     * {@code dedupeKey} is unique per user; a redelivered task with the same key stores nothing.
     */
    record NotifyPlayer(
            String userId,
            NotificationKind kind,
            String dedupeKey,
            String title,
            String message,
            JsonNode data
    ) implements DeferredTask {
        @Override
        public String taskType() {
            return TYPE_NOTIFY_PLAYER;
        }
    }
}
