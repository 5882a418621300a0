package com.lunchtable.progression.repository;

import com.lunchtable.progression.model.PlayerNotification;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface PlayerNotificationRepository extends JpaRepository<PlayerNotification, UUID> {
    List<PlayerNotification> findTop50ByUserIdOrderByCreatedAtDesc(String userId);

    @Modifying
    @Query(
            value = """
                    INSERT INTO player_notifications (
                        notification_id, user_id, kind, dedupe_key, title, message, data_json, created_at
                    )
                    VALUES (
                        :notificationId, :userId, :kind, :dedupeKey, :title, :message,
                        CAST(:dataJson AS jsonb), :createdAt
                    )
                    ON CONFLICT (user_id, dedupe_key) DO NOTHING
                    """,
            nativeQuery = true
    )
    int insertIfAbsent(
            @Param("notificationId") UUID notificationId,
            @Param("userId") String userId,
            @Param("kind") String kind,
            @Param("dedupeKey") String dedupeKey,
            @Param("title") String title,
            @Param("message") String message,
            @Param("dataJson") String dataJson,
            @Param("createdAt") OffsetDateTime createdAt
    );
}
