package com.lunchtable.progression.service.events;

import com.lunchtable.progression.model.HandlerGroup;

import java.util.List;
import java.util.UUID;

public class DomainEventDispatchException extends RuntimeException {

    private final List<HandlerGroup> failedGroups;

    public DomainEventDispatchException(UUID eventId, List<HandlerGroup> failedGroups, Throwable cause) {
        super("Handler groups " + failedGroups + " failed for event " + eventId, cause);
        this.failedGroups = List.copyOf(failedGroups);
    }

    public List<HandlerGroup> getFailedGroups() {
        return failedGroups;
    }
}
