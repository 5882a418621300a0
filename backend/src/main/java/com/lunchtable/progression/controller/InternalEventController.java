package com.lunchtable.progression.controller;

import com.lunchtable.progression.dto.ProgressionRequests;
import com.lunchtable.progression.dto.ProgressionResponses;
import com.lunchtable.progression.service.events.DomainEvent;
import com.lunchtable.progression.service.events.DomainEventCodec;
import com.lunchtable.progression.service.events.DomainEventRouter;
import com.lunchtable.progression.web.ProgressionException;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

/**
 * Ingress for game-service domain events. Events are queued, not handled inline; unknown kinds are
 * accepted and dropped.
 */
@RestController
@RequestMapping("/internal/events")
public class InternalEventController {

    private static final Logger log = LoggerFactory.getLogger(InternalEventController.class);

    private final DomainEventRouter domainEventRouter;

    public InternalEventController(DomainEventRouter domainEventRouter) {
        this.domainEventRouter = domainEventRouter;
    }

    @PostMapping
    public ResponseEntity<ProgressionResponses.EventAccepted> publish(
            @Valid @RequestBody ProgressionRequests.DomainEventEnvelope envelope
    ) {
        Optional<DomainEvent> event;
        try {
            event = DomainEventCodec.fromEnvelope(envelope.kind(), envelope.payload());
        } catch (IllegalArgumentException ex) {
            throw ProgressionException.validation("invalid_event", ex.getMessage());
        }
        if (event.isEmpty()) {
            log.warn("Ignoring domain event of unknown kind '{}'", envelope.kind());
            return ResponseEntity.status(HttpStatus.ACCEPTED)
                    .body(new ProgressionResponses.EventAccepted(envelope.kind(), false, null));
        }
        domainEventRouter.publish(event.get());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new ProgressionResponses.EventAccepted(envelope.kind(), true, event.get().eventId()));
    }
}
