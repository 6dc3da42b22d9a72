package com.runeledger.model;

/**
 * Statistic an achievement threshold is compared against.
 */
public enum AchievementCriterion {
    WINS,
    WIN_STREAK,
    HIGHEST_STREAK,
    TOTAL_BATTLES,
    TOTAL_LEVEL,
    COMBAT_LEVEL;

    public boolean isBattleCriterion() {
        return this == WINS || this == WIN_STREAK || this == HIGHEST_STREAK || this == TOTAL_BATTLES;
    }
}
