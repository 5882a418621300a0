package com.lunchtable.progression.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "battle_pass_tiers")
public class BattlePassTier {

    @Id
    @Column(name = "tier_id", nullable = false, updatable = false)
    private UUID tierId;

    @Column(name = "season_id", nullable = false, updatable = false)
    private UUID seasonId;

    @Column(name = "tier_number", nullable = false)
    private int tierNumber;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "free_reward_json", columnDefinition = "jsonb")
    private JsonNode freeRewardJson;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "premium_reward_json", columnDefinition = "jsonb")
    private JsonNode premiumRewardJson;

    @Column(name = "milestone", nullable = false)
    private boolean milestone;

    public JsonNode rewardFor(RewardTrack track) {
        JsonNode reward = track == RewardTrack.PREMIUM ? premiumRewardJson : freeRewardJson;
        return reward == null || reward.isNull() ? null : reward;
    }
}
