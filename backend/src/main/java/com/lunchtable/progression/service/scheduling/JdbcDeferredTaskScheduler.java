package com.lunchtable.progression.service.scheduling;

import com.lunchtable.progression.model.DeferredTaskRecord;
import com.lunchtable.progression.model.DeferredTaskStatus;
import com.lunchtable.progression.repository.DeferredTaskRecordRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.UUID;

/**
 * Outbox-backed scheduler. Rows are drained by {@link DeferredTaskWorker}.
 */
@Service
@RequiredArgsConstructor
public class JdbcDeferredTaskScheduler implements DeferredTaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(JdbcDeferredTaskScheduler.class);

    private final DeferredTaskRecordRepository deferredTaskRecordRepository;
    private final Clock clock;

    @Override
    @Transactional
    public void schedule(DeferredTask task, Duration delay) {
        persist(task, delay);
    }

    /**
     * Persists outside any caller transaction, for use from after-commit callbacks.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void scheduleDetached(DeferredTask task, Duration delay) {
        persist(task, delay);
    }

    private void persist(DeferredTask task, Duration delay) {
        DeferredTask requiredTask = Objects.requireNonNull(task, "task is required");
        Duration effectiveDelay = delay == null || delay.isNegative() ? Duration.ZERO : delay;
        OffsetDateTime now = OffsetDateTime.now(clock);

        DeferredTaskRecord record = new DeferredTaskRecord();
        record.setTaskId(UUID.randomUUID());
        record.setTaskType(requiredTask.taskType());
        record.setPayloadJson(DeferredTaskCodec.toPayload(requiredTask));
        record.setStatus(DeferredTaskStatus.PENDING);
        record.setRunAt(now.plus(effectiveDelay));
        record.setCreatedAt(now);
        record.setUpdatedAt(now);
        deferredTaskRecordRepository.save(record);
        log.debug("Scheduled {} task {} to run at {}", record.getTaskType(), record.getTaskId(), record.getRunAt());
    }
}
