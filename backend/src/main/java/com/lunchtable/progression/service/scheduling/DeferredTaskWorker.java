package com.lunchtable.progression.service.scheduling;

import com.lunchtable.progression.config.ProgressionProperties;
import com.lunchtable.progression.model.DeferredTaskRecord;
import com.lunchtable.progression.model.DeferredTaskStatus;
import com.lunchtable.progression.repository.DeferredTaskRecordRepository;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Drains the outbox table. Claims due rows with {@code FOR UPDATE SKIP LOCKED}, leases them, runs each
 * in its own transaction and retries failures with linear backoff up to the configured attempt cap.
 */
@Service
public class DeferredTaskWorker {

    private static final Logger log = LoggerFactory.getLogger(DeferredTaskWorker.class);
    private static final int MAX_ERROR_LENGTH = 2_000;

    private final DeferredTaskRecordRepository deferredTaskRecordRepository;
    private final DeferredTaskDispatcher deferredTaskDispatcher;
    private final ProgressionProperties progressionProperties;
    private final TransactionTemplate transactionTemplate;
    private final ObjectProvider<RedisDeferredTaskScheduler> redisDeferredTaskScheduler;
    private final Clock clock;

    public DeferredTaskWorker(
            DeferredTaskRecordRepository deferredTaskRecordRepository,
            DeferredTaskDispatcher deferredTaskDispatcher,
            ProgressionProperties progressionProperties,
            TransactionTemplate transactionTemplate,
            ObjectProvider<RedisDeferredTaskScheduler> redisDeferredTaskScheduler,
            Clock clock
    ) {
        this.deferredTaskRecordRepository = deferredTaskRecordRepository;
        this.deferredTaskDispatcher = deferredTaskDispatcher;
        this.progressionProperties = progressionProperties;
        this.transactionTemplate = transactionTemplate;
        this.redisDeferredTaskScheduler = redisDeferredTaskScheduler;
        this.clock = clock;
    }

    @PostConstruct
    void registerRedisConsumer() {
        redisDeferredTaskScheduler.ifAvailable(scheduler -> scheduler.setConsumer(deferredTaskDispatcher::dispatch));
    }

    @Scheduled(
            fixedDelayString = "${progression.scheduler.poll-interval-ms:1000}",
            initialDelayString = "${progression.scheduler.initial-delay-ms:5000}"
    )
    public void processDueTasks() {
        TickSummary tickSummary = drainOnce();
        if (tickSummary.hasWork()) {
            log.info(
                    "Deferred task tick: leasesReleased={}, claimed={}, succeeded={}, retried={}, failed={}",
                    tickSummary.leasesReleased(),
                    tickSummary.claimed(),
                    tickSummary.succeeded(),
                    tickSummary.retried(),
                    tickSummary.failed()
            );
        } else {
            log.debug("Deferred task tick completed with no due tasks");
        }
    }

    public TickSummary drainOnce() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        Integer released = transactionTemplate.execute(status -> deferredTaskRecordRepository.releaseExpiredLeases(now));
        List<ClaimedTask> claimedTasks = claimDueTasks(now);

        int succeeded = 0;
        int retried = 0;
        int failed = 0;
        for (ClaimedTask claimedTask : claimedTasks) {
            switch (runClaimedTask(claimedTask)) {
                case SUCCEEDED -> succeeded++;
                case RETRIED -> retried++;
                case FAILED -> failed++;
            }
        }
        return new TickSummary(released == null ? 0 : released, claimedTasks.size(), succeeded, retried, failed);
    }

    private List<ClaimedTask> claimDueTasks(OffsetDateTime now) {
        ProgressionProperties.Scheduler scheduler = progressionProperties.getScheduler();
        OffsetDateTime leaseDeadline = now.plusSeconds(scheduler.getLeaseSeconds());
        List<ClaimedTask> claimed = transactionTemplate.execute(status -> {
            List<DeferredTaskRecord> dueRecords =
                    deferredTaskRecordRepository.findDueForClaim(now, Math.max(1, scheduler.getBatchSize()));
            for (DeferredTaskRecord record : dueRecords) {
                record.setStatus(DeferredTaskStatus.PROCESSING);
                record.setLockedUntil(leaseDeadline);
                record.setAttempts(record.getAttempts() + 1);
                record.setUpdatedAt(now);
            }
            deferredTaskRecordRepository.saveAll(dueRecords);
            return dueRecords.stream()
                    .map(record -> new ClaimedTask(
                            record.getTaskId(),
                            record.getTaskType(),
                            record,
                            record.getAttempts()
                    ))
                    .toList();
        });
        return claimed == null ? List.of() : claimed;
    }

    private Outcome runClaimedTask(ClaimedTask claimedTask) {
        DeferredTask task;
        try {
            task = DeferredTaskCodec.fromPayload(claimedTask.taskType(), claimedTask.record().getPayloadJson());
        } catch (IllegalArgumentException ex) {
            log.error("Deferred task {} cannot be decoded: {}", claimedTask.taskId(), ex.getMessage());
            markFailed(claimedTask.taskId(), ex);
            return Outcome.FAILED;
        }

        try {
            deferredTaskDispatcher.dispatch(task);
        } catch (RuntimeException ex) {
            return handleFailure(claimedTask, ex);
        }

        transactionTemplate.executeWithoutResult(status ->
                deferredTaskRecordRepository.findById(claimedTask.taskId()).ifPresent(record -> {
                    record.setStatus(DeferredTaskStatus.DONE);
                    record.setLockedUntil(null);
                    record.setUpdatedAt(OffsetDateTime.now(clock));
                    deferredTaskRecordRepository.save(record);
                })
        );
        return Outcome.SUCCEEDED;
    }

    private Outcome handleFailure(ClaimedTask claimedTask, RuntimeException ex) {
        ProgressionProperties.Scheduler scheduler = progressionProperties.getScheduler();
        if (claimedTask.attempts() >= scheduler.getMaxAttempts()) {
            log.error(
                    "Deferred {} task {} failed after {} attempts",
                    claimedTask.taskType(),
                    claimedTask.taskId(),
                    claimedTask.attempts(),
                    ex
            );
            markFailed(claimedTask.taskId(), ex);
            return Outcome.FAILED;
        }

        Duration backoff = Duration.ofSeconds(scheduler.getRetryBackoffSeconds() * claimedTask.attempts());
        log.warn(
                "Deferred {} task {} failed on attempt {}; retrying in {}: {}",
                claimedTask.taskType(),
                claimedTask.taskId(),
                claimedTask.attempts(),
                backoff,
                ex.getMessage()
        );
        transactionTemplate.executeWithoutResult(status ->
                deferredTaskRecordRepository.findById(claimedTask.taskId()).ifPresent(record -> {
                    OffsetDateTime now = OffsetDateTime.now(clock);
                    record.setStatus(DeferredTaskStatus.PENDING);
                    record.setLockedUntil(null);
                    record.setRunAt(now.plus(backoff));
                    record.setLastError(truncate(ex.toString()));
                    record.setUpdatedAt(now);
                    deferredTaskRecordRepository.save(record);
                })
        );
        return Outcome.RETRIED;
    }

    private void markFailed(UUID taskId, RuntimeException ex) {
        transactionTemplate.executeWithoutResult(status ->
                deferredTaskRecordRepository.findById(taskId).ifPresent(record -> {
                    record.setStatus(DeferredTaskStatus.FAILED);
                    record.setLockedUntil(null);
                    record.setLastError(truncate(ex.toString()));
                    record.setUpdatedAt(OffsetDateTime.now(clock));
                    deferredTaskRecordRepository.save(record);
                })
        );
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= MAX_ERROR_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_ERROR_LENGTH);
    }

    private enum Outcome {
        SUCCEEDED,
        RETRIED,
        FAILED
    }

    private record ClaimedTask(UUID taskId, String taskType, DeferredTaskRecord record, int attempts) {
    }

    public record TickSummary(int leasesReleased, int claimed, int succeeded, int retried, int failed) {
        public boolean hasWork() {
            return leasesReleased > 0 || claimed > 0;
        }
    }
}
