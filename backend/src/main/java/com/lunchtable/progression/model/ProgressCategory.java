package com.lunchtable.progression.model;

public enum ProgressCategory {
    DAILY_QUEST,
    WEEKLY_QUEST,
    ACHIEVEMENT;

    public boolean isQuest() {
        return this != ACHIEVEMENT;
    }
}
