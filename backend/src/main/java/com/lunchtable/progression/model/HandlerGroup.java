package com.lunchtable.progression.model;

/**
 * Domain event consumers, declared in dispatch order.
 */
public enum HandlerGroup {
    PROGRESSION,
    ECONOMY,
    STATS
}
