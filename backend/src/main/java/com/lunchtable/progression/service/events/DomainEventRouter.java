package com.lunchtable.progression.service.events;

import com.fasterxml.jackson.databind.JsonNode;
import com.lunchtable.progression.model.DomainEventReceipt;
import com.lunchtable.progression.model.HandlerGroup;
import com.lunchtable.progression.repository.DomainEventReceiptRepository;
import com.lunchtable.progression.service.scheduling.DeferredTask;
import com.lunchtable.progression.service.scheduling.DeferredTaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Fans a domain event out to the handler groups in {@link HandlerGroup} declaration order.
 * <p>
 * Each group runs in its own transaction together with its receipt row, so a redelivered event
 * skips the groups that already committed. A failing group does not stop the ones after it; the
 * failure is rethrown once all groups ran so the deferred task is retried.
 */
@Service
public class DomainEventRouter {

    private static final Logger log = LoggerFactory.getLogger(DomainEventRouter.class);

    private final Map<HandlerGroup, DomainEventHandler> handlers;
    private final DomainEventReceiptRepository domainEventReceiptRepository;
    private final DeferredTaskScheduler deferredTaskScheduler;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public DomainEventRouter(
            List<DomainEventHandler> handlers,
            DomainEventReceiptRepository domainEventReceiptRepository,
            DeferredTaskScheduler deferredTaskScheduler,
            TransactionTemplate transactionTemplate,
            Clock clock
    ) {
        this.handlers = indexByGroup(handlers);
        this.domainEventReceiptRepository = domainEventReceiptRepository;
        this.deferredTaskScheduler = deferredTaskScheduler;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    private static Map<HandlerGroup, DomainEventHandler> indexByGroup(List<DomainEventHandler> handlers) {
        Map<HandlerGroup, DomainEventHandler> indexed = new EnumMap<>(HandlerGroup.class);
        for (DomainEventHandler handler : handlers) {
            DomainEventHandler previous = indexed.put(handler.group(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate domain event handlers for group " + handler.group());
            }
        }
        return indexed;
    }

    /**
     * Schedules dispatch. Inside a transaction the task commits, or rolls back, with the caller.
     */
    public void publish(DomainEvent event) {
        Objects.requireNonNull(event, "event is required");
        deferredTaskScheduler.scheduleNow(new DeferredTask.DispatchDomainEvent(event.kind(), DomainEventCodec.toPayload(event)));
        log.debug("Published {} event {}", event.kind(), event.eventId());
    }

    /**
     * Decodes and dispatches a raw envelope. Unknown kinds are dropped.
     *
     * @return the dispatch result, empty when the event was dropped
     */
    public Optional<DispatchResult> dispatchEnvelope(String kind, JsonNode payload) {
        Optional<DomainEvent> event = DomainEventCodec.fromEnvelope(kind, payload);
        if (event.isEmpty()) {
            log.warn("Dropping domain event of unknown kind '{}'", kind);
            return Optional.empty();
        }
        return Optional.of(dispatch(event.get()));
    }

    public DispatchResult dispatch(DomainEvent event) {
        List<HandlerGroup> processed = new ArrayList<>();
        List<HandlerGroup> skipped = new ArrayList<>();
        List<HandlerGroup> failed = new ArrayList<>();
        RuntimeException firstFailure = null;

        for (HandlerGroup group : HandlerGroup.values()) {
            DomainEventHandler handler = handlers.get(group);
            if (handler == null) {
                continue;
            }
            try {
                Boolean ran = transactionTemplate.execute(status -> runGroup(handler, event));
                if (Boolean.TRUE.equals(ran)) {
                    processed.add(group);
                } else {
                    skipped.add(group);
                }
            } catch (RuntimeException ex) {
                log.error("Handler group {} failed for {} event {}", group, event.kind(), event.eventId(), ex);
                failed.add(group);
                if (firstFailure == null) {
                    firstFailure = ex;
                }
            }
        }

        if (firstFailure != null) {
            throw new DomainEventDispatchException(event.eventId(), failed, firstFailure);
        }
        log.info("Dispatched {} event {}: processed={}, skipped={}", event.kind(), event.eventId(), processed, skipped);
        return new DispatchResult(event.eventId(), processed, skipped);
    }

    private boolean runGroup(DomainEventHandler handler, DomainEvent event) {
        UUID eventId = event.eventId();
        if (domainEventReceiptRepository.existsByEventIdAndHandlerGroup(eventId, handler.group())) {
            log.debug("Event {} already handled by {}", eventId, handler.group());
            return false;
        }
        handler.handle(event);

        DomainEventReceipt receipt = new DomainEventReceipt();
        receipt.setReceiptId(UUID.randomUUID());
        receipt.setEventId(eventId);
        receipt.setHandlerGroup(handler.group());
        receipt.setEventKind(event.kind());
        receipt.setProcessedAt(OffsetDateTime.now(clock));
        domainEventReceiptRepository.save(receipt);
        return true;
    }

    public record DispatchResult(UUID eventId, List<HandlerGroup> processed, List<HandlerGroup> skipped) {
    }
}
