package com.lunchtable.progression.repository;

import com.lunchtable.progression.model.BattlePassProgress;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface BattlePassProgressRepository extends JpaRepository<BattlePassProgress, UUID> {
    Optional<BattlePassProgress> findByUserIdAndSeasonId(String userId, UUID seasonId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from BattlePassProgress p where p.userId = :userId and p.seasonId = :seasonId")
    Optional<BattlePassProgress> findByUserIdAndSeasonIdForUpdate(
            @Param("userId") String userId,
            @Param("seasonId") UUID seasonId
    );

    @Modifying
    @Query(
            value = """
                    INSERT INTO battle_pass_progress (progress_id, user_id, season_id, created_at, updated_at)
                    VALUES (:progressId, :userId, :seasonId, :now, :now)
                    ON CONFLICT (user_id, season_id) DO NOTHING
                    """,
            nativeQuery = true
    )
    int insertIfAbsent(
            @Param("progressId") UUID progressId,
            @Param("userId") String userId,
            @Param("seasonId") UUID seasonId,
            @Param("now") OffsetDateTime now
    );
}
