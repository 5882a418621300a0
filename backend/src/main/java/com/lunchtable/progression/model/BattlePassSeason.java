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
@Table(name = "battle_pass_seasons")
public class BattlePassSeason {

    @Id
    @Column(name = "season_id", nullable = false, updatable = false)
    private UUID seasonId;

    @Column(name = "season_number", nullable = false)
    private int seasonNumber;

    @Column(name = "name", nullable = false, length = 128)
    private String name;

    @Column(name = "xp_per_tier", nullable = false)
    private int xpPerTier;

    @Column(name = "total_tiers", nullable = false)
    private int totalTiers;

    @Column(name = "premium_gem_price")
    private Long premiumGemPrice;

    /**
     * Raw token units (before decimals).
     */
    @Column(name = "premium_token_price")
    private Long premiumTokenPrice;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private SeasonStatus status = SeasonStatus.UPCOMING;

    @Column(name = "starts_at", nullable = false)
    private OffsetDateTime startsAt;

    @Column(name = "ends_at", nullable = false)
    private OffsetDateTime endsAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
