package com.lunchtable.progression.service;

import com.lunchtable.progression.model.GameMode;
import com.lunchtable.progression.model.RequirementKind;

/**
 * Something a player did that may advance quests or achievements.
 *
 * @param gameMode  optional, matched against definition game-mode filters
 * @param archetype optional, matched against definition archetype filters
 */
public record ProgressEvent(RequirementKind kind, int value, GameMode gameMode, String archetype) {

    public static ProgressEvent of(RequirementKind kind, GameMode gameMode, String archetype) {
        return new ProgressEvent(kind, 1, gameMode, archetype);
    }
}
