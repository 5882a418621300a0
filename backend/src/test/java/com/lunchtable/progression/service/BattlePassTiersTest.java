package com.lunchtable.progression.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class BattlePassTiersTest {

    @Test
    void tierIsFlooredXpOverTierSizeClampedToTotal() {
        int[] tierSizes = {1, 7, 100, 1000};
        int[] totals = {1, 10, 50};
        long[] xpValues = {0, 1, 99, 100, 250, 999, 1000, 49_999, 50_000, 1_000_000};
        for (int xpPerTier : tierSizes) {
            for (int totalTiers : totals) {
                for (long xp : xpValues) {
                    long expected = Math.min(xp / xpPerTier, totalTiers);
                    assertEquals(expected, BattlePassTiers.tierFor(xp, xpPerTier, totalTiers),
                            "xp=" + xp + " xpPerTier=" + xpPerTier + " totalTiers=" + totalTiers);
                }
            }
        }
    }

    @Test
    void nonPositiveTierSizeYieldsTierZero() {
        assertEquals(0, BattlePassTiers.tierFor(5_000, 0, 50));
        assertEquals(0, BattlePassTiers.tierFor(5_000, -10, 50));
    }

    @Test
    void xpToNextTierAndProgressWithinTier() {
        assertEquals(50, BattlePassTiers.xpToNextTier(250, 100, 50));
        assertEquals(0.5, BattlePassTiers.tierProgress(250, 100, 50), 1e-9);
    }

    @Test
    void maxedPassNeedsNoMoreXp() {
        assertEquals(0, BattlePassTiers.xpToNextTier(10_000, 100, 50));
        assertEquals(1.0, BattlePassTiers.tierProgress(10_000, 100, 50), 1e-9);
    }
}
