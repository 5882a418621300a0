package com.lunchtable.progression.service.scheduling;

@FunctionalInterface
public interface DeferredTaskConsumer {

    void accept(DeferredTask task);
}
