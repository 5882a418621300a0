package com.lunchtable.progression.service.scheduling;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.lunchtable.progression.config.ProgressionProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Delay queue on a Redis sorted set scored by due time in epoch millis. Claimed members move to an
 * in-flight set scored by lease deadline and return to the queue if the lease lapses.
 * Falls back to the outbox table while Redis is unreachable.
 */
@Service
@Primary
@ConditionalOnProperty(
        prefix = "progression.scheduler",
        name = "mode",
        havingValue = "redis"
)
public class RedisDeferredTaskScheduler implements DeferredTaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(RedisDeferredTaskScheduler.class);
    private static final ObjectMapper OBJECT_MAPPER = JsonMapper.builder().build();
    private static final Duration REDIS_FAILURE_BACKOFF = Duration.ofSeconds(5);

    private final StringRedisTemplate stringRedisTemplate;
    private final ProgressionProperties progressionProperties;
    private final JdbcDeferredTaskScheduler fallbackScheduler;
    private final Clock clock;

    private volatile boolean running = true;
    private volatile DeferredTaskConsumer consumer;
    private volatile boolean fallbackMode;
    private volatile long redisRetryNotBeforeNanos;
    private Thread dispatcherThread;

    public RedisDeferredTaskScheduler(
            StringRedisTemplate stringRedisTemplate,
            ProgressionProperties progressionProperties,
            JdbcDeferredTaskScheduler fallbackScheduler,
            Clock clock
    ) {
        this.stringRedisTemplate = stringRedisTemplate;
        this.progressionProperties = progressionProperties;
        this.fallbackScheduler = fallbackScheduler;
        this.clock = clock;
    }

    @PostConstruct
    void startDispatcher() {
        dispatcherThread = new Thread(this::dispatchLoop, "progression-deferred-task-redis-dispatcher");
        dispatcherThread.setDaemon(true);
        dispatcherThread.start();
    }

    @PreDestroy
    void stopDispatcher() {
        running = false;
        if (dispatcherThread != null) {
            dispatcherThread.interrupt();
        }
    }

    public void setConsumer(DeferredTaskConsumer consumer) {
        this.consumer = Objects.requireNonNull(consumer, "consumer is required");
    }

    @Override
    public void schedule(DeferredTask task, Duration delay) {
        DeferredTask requiredTask = Objects.requireNonNull(task, "task is required");
        Duration effectiveDelay = delay == null || delay.isNegative() ? Duration.ZERO : delay;
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    push(requiredTask, effectiveDelay);
                }
            });
            return;
        }
        push(requiredTask, effectiveDelay);
    }

    void push(DeferredTask task, Duration delay) {
        if (!shouldAttemptRedis()) {
            fallbackScheduler.scheduleDetached(task, delay);
            return;
        }
        String member = serialize(task);
        double dueAtMillis = clock.millis() + delay.toMillis();
        try {
            Boolean added = stringRedisTemplate.opsForZSet().add(resolveQueueKey(), member, dueAtMillis);
            if (added != null) {
                markRedisHealthy();
                return;
            }
            log.warn("Redis deferred task push returned null, routing task to the outbox table");
            markRedisFailure(null);
        } catch (RuntimeException ex) {
            markRedisFailure(ex);
        }
        fallbackScheduler.scheduleDetached(task, delay);
    }

    /**
     * Claims and runs due tasks once.
     *
     * @return number of tasks handed to the consumer
     */
    int pollOnce() {
        DeferredTaskConsumer taskConsumer = consumer;
        if (taskConsumer == null || !shouldAttemptRedis()) {
            return 0;
        }
        String queueKey = resolveQueueKey();
        String inflightKey = resolveInflightKey();
        long nowMillis = clock.millis();

        requeueExpiredInflight(queueKey, inflightKey, nowMillis);

        Set<String> dueMembers = stringRedisTemplate.opsForZSet().rangeByScore(
                queueKey,
                0,
                nowMillis,
                0,
                progressionProperties.getScheduler().getBatchSize()
        );
        markRedisHealthy();
        if (dueMembers == null || dueMembers.isEmpty()) {
            return 0;
        }

        long leaseDeadline = nowMillis + TimeUnit.SECONDS.toMillis(progressionProperties.getScheduler().getLeaseSeconds());
        int dispatched = 0;
        for (String member : dueMembers) {
            Long removed = stringRedisTemplate.opsForZSet().remove(queueKey, member);
            if (removed == null || removed == 0L) {
                continue;
            }
            stringRedisTemplate.opsForZSet().add(inflightKey, member, leaseDeadline);
            DeferredTask task;
            try {
                task = deserialize(member);
            } catch (IllegalArgumentException | IllegalStateException ex) {
                log.error("Dropping undecodable deferred task from Redis: {}", ex.getMessage());
                stringRedisTemplate.opsForZSet().remove(inflightKey, member);
                continue;
            }
            try {
                taskConsumer.accept(task);
            } catch (RuntimeException ex) {
                Duration retryDelay = Duration.ofSeconds(progressionProperties.getScheduler().getRetryBackoffSeconds());
                log.warn(
                        "Deferred {} task failed from Redis; retrying through the outbox in {}: {}",
                        task.taskType(),
                        retryDelay,
                        resolveSafeMessage(ex)
                );
                fallbackScheduler.scheduleDetached(task, retryDelay);
            } finally {
                stringRedisTemplate.opsForZSet().remove(inflightKey, member);
            }
            dispatched++;
        }
        return dispatched;
    }

    private void requeueExpiredInflight(String queueKey, String inflightKey, long nowMillis) {
        Set<String> expired = stringRedisTemplate.opsForZSet().rangeByScore(inflightKey, 0, nowMillis);
        if (expired == null) {
            return;
        }
        for (String member : expired) {
            Long removed = stringRedisTemplate.opsForZSet().remove(inflightKey, member);
            if (removed != null && removed > 0L) {
                stringRedisTemplate.opsForZSet().add(queueKey, member, nowMillis);
                log.info("Re-queued deferred task whose Redis lease expired");
            }
        }
    }

    private void dispatchLoop() {
        while (running) {
            try {
                int dispatched = pollOnce();
                if (dispatched == 0) {
                    TimeUnit.MILLISECONDS.sleep(progressionProperties.getScheduler().getPollIntervalMs());
                }
            } catch (InterruptedException ex) {
                if (!running) {
                    Thread.currentThread().interrupt();
                    return;
                }
            } catch (RuntimeException ex) {
                markRedisFailure(ex);
            }
        }
    }

    private String resolveQueueKey() {
        return requireKey(progressionProperties.getScheduler().getRedisQueueKey(), "progression.scheduler.redis-queue-key");
    }

    private String resolveInflightKey() {
        return requireKey(progressionProperties.getScheduler().getRedisInflightKey(), "progression.scheduler.redis-inflight-key");
    }

    private String requireKey(String key, String propertyName) {
        if (key == null || key.isBlank()) {
            throw new IllegalStateException(propertyName + " must not be blank");
        }
        return key.trim();
    }

    private String serialize(DeferredTask task) {
        RedisTaskEnvelope envelope = new RedisTaskEnvelope(
                UUID.randomUUID(),
                task.taskType(),
                DeferredTaskCodec.toPayload(task)
        );
        try {
            return OBJECT_MAPPER.writeValueAsString(envelope);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize deferred task envelope", ex);
        }
    }

    private DeferredTask deserialize(String member) {
        try {
            RedisTaskEnvelope envelope = OBJECT_MAPPER.readValue(member, RedisTaskEnvelope.class);
            return DeferredTaskCodec.fromPayload(envelope.type(), envelope.payload());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to deserialize deferred task envelope", ex);
        }
    }

    private boolean shouldAttemptRedis() {
        return System.nanoTime() >= redisRetryNotBeforeNanos;
    }

    private void markRedisFailure(RuntimeException ex) {
        redisRetryNotBeforeNanos = System.nanoTime() + REDIS_FAILURE_BACKOFF.toNanos();
        if (!fallbackMode) {
            fallbackMode = true;
            if (ex == null) {
                log.warn("Redis deferred task queue is unavailable; switching to outbox fallback mode");
            } else {
                log.warn(
                        "Redis deferred task queue is unavailable ({}); switching to outbox fallback mode",
                        resolveSafeMessage(ex)
                );
            }
        }
    }

    private void markRedisHealthy() {
        if (fallbackMode) {
            log.info("Redis deferred task queue restored; leaving outbox fallback mode");
        }
        fallbackMode = false;
        redisRetryNotBeforeNanos = 0L;
    }

    private String resolveSafeMessage(RuntimeException ex) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            return ex.getClass().getSimpleName();
        }
        return message;
    }

    /**
     * The random id keeps identical tasks distinct as sorted-set members.
     */
    record RedisTaskEnvelope(UUID id, String type, JsonNode payload) {
    }
}
