package com.lunchtable.progression.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Per-user, per-season pass state. {@code currentTier} is derived from {@code currentXp} on every write.
 */
@Getter
@Setter
@Entity
@Table(name = "battle_pass_progress")
public class BattlePassProgress {

    @Id
    @Column(name = "progress_id", nullable = false, updatable = false)
    private UUID progressId;

    @Column(name = "user_id", nullable = false, updatable = false, length = 64)
    private String userId;

    @Column(name = "season_id", nullable = false, updatable = false)
    private UUID seasonId;

    @Column(name = "current_xp", nullable = false)
    private long currentXp;

    @Column(name = "current_tier", nullable = false)
    private int currentTier;

    @Column(name = "premium", nullable = false)
    private boolean premium;

    @Enumerated(EnumType.STRING)
    @Column(name = "premium_source", length = 16)
    private PremiumSource premiumSource;

    @Column(name = "premium_purchased_at")
    private OffsetDateTime premiumPurchasedAt;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "claimed_free_tiers", nullable = false, columnDefinition = "jsonb")
    private List<Integer> claimedFreeTiers = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "claimed_premium_tiers", nullable = false, columnDefinition = "jsonb")
    private List<Integer> claimedPremiumTiers = new ArrayList<>();

    @Column(name = "last_xp_gain_at")
    private OffsetDateTime lastXpGainAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    public boolean hasClaimed(int tier, RewardTrack track) {
        return claimedTiers(track).contains(tier);
    }

    public void markClaimed(int tier, RewardTrack track) {
        List<Integer> claimed = new ArrayList<>(claimedTiers(track));
        claimed.add(tier);
        if (track == RewardTrack.PREMIUM) {
            claimedPremiumTiers = claimed;
        } else {
            claimedFreeTiers = claimed;
        }
    }

    private List<Integer> claimedTiers(RewardTrack track) {
        List<Integer> claimed = track == RewardTrack.PREMIUM ? claimedPremiumTiers : claimedFreeTiers;
        return claimed == null ? List.of() : claimed;
    }
}
