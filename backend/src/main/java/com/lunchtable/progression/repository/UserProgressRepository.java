package com.lunchtable.progression.repository;

import com.lunchtable.progression.model.ProgressCategory;
import com.lunchtable.progression.model.ProgressStatus;
import com.lunchtable.progression.model.UserProgress;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface UserProgressRepository extends JpaRepository<UserProgress, UUID> {
    List<UserProgress> findByUserIdAndCategoryAndPeriodKey(String userId, ProgressCategory category, String periodKey);

    List<UserProgress> findByUserIdAndCategory(String userId, ProgressCategory category);

    @Query("""
            select p from UserProgress p
            where p.userId = :userId
              and p.category in :categories
              and p.expiresAt > :now
            order by p.createdAt asc
            """)
    List<UserProgress> findCurrentQuests(
            @Param("userId") String userId,
            @Param("categories") Collection<ProgressCategory> categories,
            @Param("now") OffsetDateTime now
    );

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            select p from UserProgress p
            where p.userId = :userId
              and p.category in :categories
              and p.status = :status
              and p.expiresAt > :now
            order by p.createdAt asc
            """)
    List<UserProgress> findOpenQuestsForUpdate(
            @Param("userId") String userId,
            @Param("categories") Collection<ProgressCategory> categories,
            @Param("status") ProgressStatus status,
            @Param("now") OffsetDateTime now
    );

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from UserProgress p where p.progressId = :progressId")
    Optional<UserProgress> findByProgressIdForUpdate(@Param("progressId") UUID progressId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            select p from UserProgress p
            where p.userId = :userId
              and p.definitionId = :definitionId
              and p.periodKey = :periodKey
            """)
    Optional<UserProgress> findByUserIdAndDefinitionIdAndPeriodKeyForUpdate(
            @Param("userId") String userId,
            @Param("definitionId") String definitionId,
            @Param("periodKey") String periodKey
    );

    @Modifying
    @Query(
            value = """
                    INSERT INTO user_progress (
                        progress_id, user_id, definition_id, category, period_key,
                        current_progress, target_value, status, started_at, expires_at,
                        created_at, updated_at
                    )
                    VALUES (
                        :progressId, :userId, :definitionId, :category, :periodKey,
                        0, :targetValue, 'ACTIVE', :startedAt, :expiresAt,
                        :startedAt, :startedAt
                    )
                    ON CONFLICT (user_id, definition_id, period_key) DO NOTHING
                    """,
            nativeQuery = true
    )
    int insertQuestIfAbsent(
            @Param("progressId") UUID progressId,
            @Param("userId") String userId,
            @Param("definitionId") String definitionId,
            @Param("category") String category,
            @Param("periodKey") String periodKey,
            @Param("targetValue") int targetValue,
            @Param("startedAt") OffsetDateTime startedAt,
            @Param("expiresAt") OffsetDateTime expiresAt
    );

    @Modifying
    @Query(
            value = """
                    INSERT INTO user_progress (
                        progress_id, user_id, definition_id, category, period_key,
                        current_progress, target_value, status, started_at,
                        created_at, updated_at
                    )
                    VALUES (
                        :progressId, :userId, :definitionId, 'ACHIEVEMENT', 'permanent',
                        0, :targetValue, 'LOCKED', :startedAt,
                        :startedAt, :startedAt
                    )
                    ON CONFLICT (user_id, definition_id, period_key) DO NOTHING
                    """,
            nativeQuery = true
    )
    int insertAchievementIfAbsent(
            @Param("progressId") UUID progressId,
            @Param("userId") String userId,
            @Param("definitionId") String definitionId,
            @Param("targetValue") int targetValue,
            @Param("startedAt") OffsetDateTime startedAt
    );

    @Modifying
    @Query("""
            delete from UserProgress p
            where p.category in :categories
              and p.expiresAt <= :now
              and p.status <> :retainedStatus
            """)
    int deleteExpired(
            @Param("categories") Collection<ProgressCategory> categories,
            @Param("now") OffsetDateTime now,
            @Param("retainedStatus") ProgressStatus retainedStatus
    );
}
