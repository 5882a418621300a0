package com.lunchtable.progression.service.events;

import com.lunchtable.progression.model.HandlerGroup;

/**
 * One handler group. Runs inside the router's per-group transaction.
 */
public interface DomainEventHandler {

    HandlerGroup group();

    void handle(DomainEvent event);
}
