package com.lunchtable.progression.model;

public enum NotificationKind {
    TIER_UP,
    ACHIEVEMENT_UNLOCKED,
    QUEST_COMPLETED,
    PURCHASE_CONFIRMED,
    PURCHASE_FAILED
}
