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

/**
 * Token-paid premium pass purchase. Rows are never deleted and only move forward through {@link PurchaseStatus}.
 */
@Getter
@Setter
@Entity
@Table(name = "pending_purchases")
public class PendingPurchase {

    @Id
    @Column(name = "purchase_id", nullable = false, updatable = false)
    private UUID purchaseId;

    @Column(name = "buyer_id", nullable = false, updatable = false, length = 64)
    private String buyerId;

    @Column(name = "season_id", nullable = false, updatable = false)
    private UUID seasonId;

    @Column(name = "amount", nullable = false, updatable = false)
    private long amount;

    @Column(name = "buyer_wallet", nullable = false, updatable = false, length = 64)
    private String buyerWallet;

    @Column(name = "treasury_wallet", nullable = false, updatable = false, length = 64)
    private String treasuryWallet;

    @Column(name = "token_mint", nullable = false, updatable = false, length = 64)
    private String tokenMint;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private PurchaseStatus status = PurchaseStatus.AWAITING_SIGNATURE;

    @Column(name = "signature", length = 128)
    private String signature;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_reason", length = 32)
    private PurchaseFailureReason failureReason;

    @Column(name = "failure_detail", columnDefinition = "TEXT")
    private String failureDetail;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "expires_at", nullable = false)
    private OffsetDateTime expiresAt;

    @Column(name = "submitted_at")
    private OffsetDateTime submittedAt;

    @Column(name = "resolved_at")
    private OffsetDateTime resolvedAt;

    @Column(name = "last_polled_at")
    private OffsetDateTime lastPolledAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
