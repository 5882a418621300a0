package com.lunchtable.progression.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.lunchtable.progression.model.NotificationKind;
import com.lunchtable.progression.model.PlayerNotification;
import com.lunchtable.progression.repository.PlayerNotificationRepository;
import com.lunchtable.progression.service.scheduling.DeferredTask;
import com.lunchtable.progression.service.scheduling.DeferredTaskScheduler;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Player-facing notifications. Writers only enqueue; delivery runs as a deferred task after the
 * originating transaction commits.
 */
@Service
@RequiredArgsConstructor
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    private final PlayerNotificationRepository playerNotificationRepository;
    private final DeferredTaskScheduler deferredTaskScheduler;
    private final Clock clock;

    /**
     * @param referenceId what the notification is about, unique within {@code kind} for one player
     */
    public void notifyPlayer(
            String userId,
            NotificationKind kind,
            String referenceId,
            String title,
            String message,
            JsonNode data
    ) {
        deferredTaskScheduler.scheduleNow(
                new DeferredTask.NotifyPlayer(userId, kind, dedupeKey(kind, referenceId), title, message, data)
        );
    }

    @Transactional
    public boolean deliver(DeferredTask.NotifyPlayer task) {
        int inserted = playerNotificationRepository.insertIfAbsent(
                UUID.randomUUID(),
                task.userId(),
                task.kind().name(),
                task.dedupeKey(),
                task.title(),
                task.message(),
                task.data() == null ? null : task.data().toString(),
                OffsetDateTime.now(clock)
        );
        if (inserted == 0) {
            log.debug("Notification {} for user {} already delivered", task.dedupeKey(), task.userId());
            return false;
        }
        log.debug("Delivered {} notification to user {}", task.kind(), task.userId());
        return true;
    }

    static String dedupeKey(NotificationKind kind, String referenceId) {
        return kind.name() + ":" + referenceId;
    }

    @Transactional(readOnly = true)
    public List<PlayerNotification> listRecent(String userId) {
        return playerNotificationRepository.findTop50ByUserIdOrderByCreatedAtDesc(userId);
    }
}
