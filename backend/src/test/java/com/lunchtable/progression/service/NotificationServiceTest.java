package com.lunchtable.progression.service;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lunchtable.progression.model.NotificationKind;
import com.lunchtable.progression.repository.PlayerNotificationRepository;
import com.lunchtable.progression.service.scheduling.DeferredTask;
import com.lunchtable.progression.service.scheduling.DeferredTaskScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NotificationServiceTest {

    private static final String USER_ID = "player-1";
    private static final Instant NOW = Instant.parse("2026-03-02T12:00:00Z");

    @Mock
    private PlayerNotificationRepository playerNotificationRepository;

    @Mock
    private DeferredTaskScheduler deferredTaskScheduler;

    private NotificationService notificationService;

    @BeforeEach
    void setUp() {
        notificationService = new NotificationService(
                playerNotificationRepository,
                deferredTaskScheduler,
                Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    @Test
    void notifyPlayerQueuesTaskKeyedByKindAndReference() {
        ObjectNode data = JsonNodeFactory.instance.objectNode().put("newTier", 4);

        notificationService.notifyPlayer(USER_ID, NotificationKind.TIER_UP, "season-1:4", "Tier 4 reached", "Up!", data);

        ArgumentCaptor<DeferredTask> task = ArgumentCaptor.forClass(DeferredTask.class);
        verify(deferredTaskScheduler).scheduleNow(task.capture());
        DeferredTask.NotifyPlayer notify = (DeferredTask.NotifyPlayer) task.getValue();
        assertEquals("TIER_UP:season-1:4", notify.dedupeKey());
        assertEquals(USER_ID, notify.userId());
        assertEquals(4, notify.data().get("newTier").asInt());
    }

    @Test
    void redeliveredNotificationIsStoredOnce() {
        DeferredTask.NotifyPlayer task = new DeferredTask.NotifyPlayer(
                USER_ID,
                NotificationKind.PURCHASE_CONFIRMED,
                "PURCHASE_CONFIRMED:7d0c1b8e-2d36-4bb5-9f0c-2f4c4f1e7a11",
                "Premium pass unlocked",
                "Your token payment was confirmed.",
                JsonNodeFactory.instance.objectNode().put("status", "CONFIRMED")
        );
        when(playerNotificationRepository.insertIfAbsent(
                any(UUID.class),
                eq(USER_ID),
                eq("PURCHASE_CONFIRMED"),
                eq(task.dedupeKey()),
                eq("Premium pass unlocked"),
                eq("Your token payment was confirmed."),
                eq("{\"status\":\"CONFIRMED\"}"),
                eq(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC))
        )).thenReturn(1, 0);

        assertTrue(notificationService.deliver(task));
        assertFalse(notificationService.deliver(task));
    }

    @Test
    void notificationWithoutDataStoresNullJson() {
        DeferredTask.NotifyPlayer task = new DeferredTask.NotifyPlayer(
                USER_ID, NotificationKind.QUEST_COMPLETED, "QUEST_COMPLETED:daily_win_3:2026-03-02", "Done", "Claim it", null);
        when(playerNotificationRepository.insertIfAbsent(
                any(UUID.class), eq(USER_ID), eq("QUEST_COMPLETED"), eq(task.dedupeKey()),
                eq("Done"), eq("Claim it"), isNull(), any(OffsetDateTime.class)
        )).thenReturn(1);

        assertTrue(notificationService.deliver(task));
    }
}
