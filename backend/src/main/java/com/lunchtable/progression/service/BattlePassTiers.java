package com.lunchtable.progression.service;

public final class BattlePassTiers {

    private BattlePassTiers() {
    }

    /**
     * {@code min(floor(xp / xpPerTier), totalTiers)}, and 0 for a non-positive tier size.
     */
    public static int tierFor(long xp, int xpPerTier, int totalTiers) {
        if (xpPerTier <= 0 || xp <= 0 || totalTiers <= 0) {
            return 0;
        }
        long tier = xp / xpPerTier;
        return (int) Math.min(tier, totalTiers);
    }

    /**
     * XP still needed to reach the next tier, 0 once the pass is maxed.
     */
    public static long xpToNextTier(long xp, int xpPerTier, int totalTiers) {
        int tier = tierFor(xp, xpPerTier, totalTiers);
        if (xpPerTier <= 0 || tier >= totalTiers) {
            return 0;
        }
        return (long) (tier + 1) * xpPerTier - Math.max(0, xp);
    }

    /**
     * Fraction of the current tier completed, in [0, 1].
     */
    public static double tierProgress(long xp, int xpPerTier, int totalTiers) {
        int tier = tierFor(xp, xpPerTier, totalTiers);
        if (xpPerTier <= 0 || tier >= totalTiers) {
            return 1.0;
        }
        long intoTier = Math.max(0, xp) - (long) tier * xpPerTier;
        return (double) intoTier / xpPerTier;
    }
}
