package com.lunchtable.progression.repository;

import com.lunchtable.progression.model.DeferredTaskRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface DeferredTaskRecordRepository extends JpaRepository<DeferredTaskRecord, UUID> {

    @Query(
            value = """
                    SELECT deferred_task.*
                    FROM deferred_tasks deferred_task
                    WHERE deferred_task.status = 'PENDING'
                      AND deferred_task.run_at <= :now
                    ORDER BY deferred_task.run_at ASC, deferred_task.created_at ASC
                    LIMIT :limit
                    FOR UPDATE SKIP LOCKED
                    """,
            nativeQuery = true
    )
    List<DeferredTaskRecord> findDueForClaim(@Param("now") OffsetDateTime now, @Param("limit") int limit);

    @Modifying
    @Query("""
            update DeferredTaskRecord t
            set t.status = com.lunchtable.progression.model.DeferredTaskStatus.PENDING,
                t.lockedUntil = null,
                t.updatedAt = :now
            where t.status = com.lunchtable.progression.model.DeferredTaskStatus.PROCESSING
              and t.lockedUntil < :now
            """)
    int releaseExpiredLeases(@Param("now") OffsetDateTime now);
}
