package com.lunchtable.progression.model;

public enum DeferredTaskStatus {
    PENDING,
    PROCESSING,
    DONE,
    FAILED
}
