package com.lunchtable.progression.model;

public enum AchievementRarity {
    COMMON,
    RARE,
    EPIC,
    LEGENDARY
}
