package com.lunchtable.progression.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Immutable audit row, one per reward component granted. Unique on (user, reference, entry key).
 */
@Getter
@Setter
@Entity
@Table(name = "reward_ledger_entries")
public class RewardLedgerEntry {

    @Id
    @Column(name = "entry_id", nullable = false, updatable = false)
    private UUID entryId;

    @Column(name = "user_id", nullable = false, updatable = false, length = 64)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", nullable = false, updatable = false, length = 32)
    private RewardSource source;

    @Column(name = "reference_id", nullable = false, updatable = false, length = 160)
    private String referenceId;

    @Column(name = "entry_key", nullable = false, updatable = false, length = 64)
    private String entryKey;

    @Column(name = "reward_type", nullable = false, updatable = false, length = 16)
    private String rewardType;

    @Column(name = "amount", nullable = false, updatable = false)
    private long amount;

    @Column(name = "item_ref", updatable = false, length = 128)
    private String itemRef;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata_json", updatable = false, columnDefinition = "jsonb")
    private JsonNode metadataJson;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();
}
