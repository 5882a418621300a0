package com.lunchtable.progression.model;

public enum RewardTrack {
    FREE,
    PREMIUM
}
