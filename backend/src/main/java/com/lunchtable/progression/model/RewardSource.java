package com.lunchtable.progression.model;

public enum RewardSource {
    QUEST,
    ACHIEVEMENT,
    BATTLE_PASS,
    GAMEPLAY
}
