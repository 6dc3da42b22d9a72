package com.runeledger.service;

/**
 * OSRS experience curve.
 *
 * Formula: xp(L) = floor( sum_{i=1}^{L-1} floor(i + 300 * 2^(i/7)) / 4 )
 * Level 2 needs 83 xp, level 10 needs 1,154 xp and level 99 needs 13,034,431 xp.
 */
public final class ExperienceTable {

    public static final int MIN_LEVEL = 1;
    public static final int MAX_LEVEL = 99;
    public static final long MAX_EXPERIENCE = 200_000_000L;

    private static final long[] EXPERIENCE_FOR_LEVEL = buildTable();

    private ExperienceTable() {
    }

    /**
     * Minimum experience needed to reach {@code level}.
     */
    public static long experienceForLevel(int level) {
        if (level < MIN_LEVEL || level > MAX_LEVEL) {
            throw new IllegalArgumentException("level must be between " + MIN_LEVEL + " and " + MAX_LEVEL);
        }
        return EXPERIENCE_FOR_LEVEL[level];
    }

    /**
     * Highest level whose threshold does not exceed {@code experience}. Non-decreasing in experience.
     */
    public static int levelForExperience(long experience) {
        if (!isValidExperience(experience)) {
            throw new IllegalArgumentException("experience must be between 0 and " + MAX_EXPERIENCE);
        }
        int low = MIN_LEVEL;
        int high = MAX_LEVEL;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (EXPERIENCE_FOR_LEVEL[mid] <= experience) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return low;
    }

    public static boolean isValidExperience(long experience) {
        return experience >= 0 && experience <= MAX_EXPERIENCE;
    }

    private static long[] buildTable() {
        long[] table = new long[MAX_LEVEL + 1];
        long points = 0;
        for (int level = MIN_LEVEL; level <= MAX_LEVEL; level++) {
            table[level] = points / 4;
            points += (long) Math.floor(level + 300.0 * Math.pow(2.0, level / 7.0));
        }
        return table;
    }
}
