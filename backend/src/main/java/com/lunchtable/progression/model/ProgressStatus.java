package com.lunchtable.progression.model;

/**
 * Quest rows move ACTIVE, COMPLETED, CLAIMED. Achievement rows move LOCKED, UNLOCKED.
 */
public enum ProgressStatus {
    ACTIVE,
    COMPLETED,
    CLAIMED,
    LOCKED,
    UNLOCKED
}
