package com.lunchtable.progression.model;

public enum RequirementKind {
    WIN_GAME,
    PLAY_GAME,
    WIN_RANKED,
    COMPLETE_STAGE
}
