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

/**
 * Quest or achievement template. Seeded reference data, never mutated at runtime.
 */
@Getter
@Setter
@Entity
@Table(name = "progress_definitions")
public class ProgressDefinition {

    @Id
    @Column(name = "definition_id", nullable = false, updatable = false, length = 64)
    private String definitionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", nullable = false, length = 32)
    private ProgressCategory category;

    @Column(name = "name", nullable = false, length = 128)
    private String name;

    @Column(name = "description", nullable = false, columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "requirement_kind", nullable = false, length = 32)
    private RequirementKind requirementKind;

    @Column(name = "target_value", nullable = false)
    private int targetValue;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "rewards_json", nullable = false, columnDefinition = "jsonb")
    private JsonNode rewardsJson;

    @Enumerated(EnumType.STRING)
    @Column(name = "game_mode_filter", length = 16)
    private GameMode gameModeFilter;

    @Column(name = "archetype_filter", length = 64)
    private String archetypeFilter;

    @Enumerated(EnumType.STRING)
    @Column(name = "rarity", length = 16)
    private AchievementRarity rarity;

    @Column(name = "secret", nullable = false)
    private boolean secret;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    /**
     * True when the definition is active, the event kind matches and every configured filter is
     * satisfied. A retired definition stops advancing rows that were generated before retirement.
     */
    public boolean matches(RequirementKind kind, GameMode gameMode, String archetype) {
        if (!active || requirementKind != kind) {
            return false;
        }
        if (gameModeFilter != null && gameModeFilter != gameMode) {
            return false;
        }
        return archetypeFilter == null || archetypeFilter.equalsIgnoreCase(archetype);
    }
}
