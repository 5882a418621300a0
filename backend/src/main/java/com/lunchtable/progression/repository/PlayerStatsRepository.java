package com.lunchtable.progression.repository;

import com.lunchtable.progression.model.PlayerStats;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface PlayerStatsRepository extends JpaRepository<PlayerStats, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from PlayerStats s where s.userId = :userId")
    Optional<PlayerStats> findByUserIdForUpdate(@Param("userId") String userId);

    @Query("select s.userId from PlayerStats s where s.lastActiveAt >= :since order by s.userId asc")
    List<String> findUserIdsActiveSince(@Param("since") OffsetDateTime since);

    @Modifying
    @Query(
            value = """
                    INSERT INTO player_stats (user_id, last_active_at, updated_at)
                    VALUES (:userId, :now, :now)
                    ON CONFLICT (user_id) DO NOTHING
                    """,
            nativeQuery = true
    )
    int insertIfAbsent(@Param("userId") String userId, @Param("now") OffsetDateTime now);
}
