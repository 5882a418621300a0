package com.lunchtable.progression.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "token_transactions")
public class TokenTransaction {

    public static final String TYPE_PREMIUM_PASS_PURCHASE = "PREMIUM_PASS_PURCHASE";

    @Id
    @Column(name = "transaction_id", nullable = false, updatable = false)
    private UUID transactionId;

    @Column(name = "user_id", nullable = false, updatable = false, length = 64)
    private String userId;

    @Column(name = "transaction_type", nullable = false, updatable = false, length = 32)
    private String transactionType;

    /**
     * Signed raw token units; spends are negative.
     */
    @Column(name = "amount", nullable = false, updatable = false)
    private long amount;

    @Column(name = "signature", nullable = false, updatable = false, length = 128)
    private String signature;

    @Column(name = "reference_id", nullable = false, updatable = false)
    private UUID referenceId;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();
}
