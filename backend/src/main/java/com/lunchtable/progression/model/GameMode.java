package com.lunchtable.progression.model;

public enum GameMode {
    RANKED,
    CASUAL,
    STORY
}
