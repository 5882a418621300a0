package com.lunchtable.progression.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.lunchtable.progression.model.NotificationKind;
import com.lunchtable.progression.model.PlayerNotification;

import java.time.OffsetDateTime;
import java.util.UUID;

public final class ProgressionResponses {

    private ProgressionResponses() {
    }

    public record NotificationSummary(
            UUID notificationId,
            NotificationKind kind,
            String title,
            String message,
            JsonNode data,
            boolean read,
            OffsetDateTime createdAt
    ) {
        public static NotificationSummary from(PlayerNotification notification) {
            return new NotificationSummary(
                    notification.getNotificationId(),
                    notification.getKind(),
                    notification.getTitle(),
                    notification.getMessage(),
                    notification.getDataJson(),
                    notification.isRead(),
                    notification.getCreatedAt()
            );
        }
    }

    public record EventAccepted(String kind, boolean queued, UUID eventId) {
    }
}
