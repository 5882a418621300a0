package com.lunchtable.progression.model;

public enum PremiumSource {
    GEMS,
    TOKEN
}
