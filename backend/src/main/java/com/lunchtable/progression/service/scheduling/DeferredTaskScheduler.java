package com.lunchtable.progression.service.scheduling;

import java.time.Duration;

/**
 * Schedules a task to run once after a delay. Delivery is at-least-once and survives restarts.
 * When called inside a transaction the task becomes visible only if that transaction commits.
 */
public interface DeferredTaskScheduler {

    void schedule(DeferredTask task, Duration delay);

    default void scheduleNow(DeferredTask task) {
        schedule(task, Duration.ZERO);
    }
}
