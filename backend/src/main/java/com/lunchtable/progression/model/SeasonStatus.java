package com.lunchtable.progression.model;

public enum SeasonStatus {
    UPCOMING,
    ACTIVE,
    ENDED
}
