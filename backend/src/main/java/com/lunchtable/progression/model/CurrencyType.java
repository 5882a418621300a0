package com.lunchtable.progression.model;

public enum CurrencyType {
    GOLD,
    GEMS,
    XP
}
