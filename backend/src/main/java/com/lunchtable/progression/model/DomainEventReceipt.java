package com.lunchtable.progression.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "domain_event_receipts")
public class DomainEventReceipt {

    @Id
    @Column(name = "receipt_id", nullable = false, updatable = false)
    private UUID receiptId;

    @Column(name = "event_id", nullable = false, updatable = false)
    private UUID eventId;

    @Enumerated(EnumType.STRING)
    @Column(name = "handler_group", nullable = false, updatable = false, length = 16)
    private HandlerGroup handlerGroup;

    @Column(name = "event_kind", nullable = false, updatable = false, length = 48)
    private String eventKind;

    @Column(name = "processed_at", nullable = false, updatable = false)
    private OffsetDateTime processedAt = OffsetDateTime.now();
}
