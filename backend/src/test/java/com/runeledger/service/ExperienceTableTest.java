package com.runeledger.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExperienceTableTest {

    @Test
    void experienceForLevel_matchesKnownThresholds() {
        assertEquals(0L, ExperienceTable.experienceForLevel(1));
        assertEquals(83L, ExperienceTable.experienceForLevel(2));
        assertEquals(1_154L, ExperienceTable.experienceForLevel(10));
        assertEquals(101_333L, ExperienceTable.experienceForLevel(50));
        assertEquals(13_034_431L, ExperienceTable.experienceForLevel(99));
    }

    @Test
    void levelForExperience_boundariesAreInclusive() {
        assertEquals(1, ExperienceTable.levelForExperience(0));
        assertEquals(1, ExperienceTable.levelForExperience(82));
        assertEquals(2, ExperienceTable.levelForExperience(83));
        assertEquals(10, ExperienceTable.levelForExperience(1_154));
        assertEquals(98, ExperienceTable.levelForExperience(13_034_430));
        assertEquals(99, ExperienceTable.levelForExperience(13_034_431));
        assertEquals(99, ExperienceTable.levelForExperience(ExperienceTable.MAX_EXPERIENCE));
    }

    @Test
    void levelForExperience_isNonDecreasing() {
        int previous = 1;
        for (long xp = 0; xp <= 14_000_000L; xp += 9_973L) {
            int level = ExperienceTable.levelForExperience(xp);
            assertTrue(level >= previous, "level dropped at " + xp);
            previous = level;
        }
    }

    @Test
    void levelForExperience_rejectsOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> ExperienceTable.levelForExperience(-1));
        assertThrows(IllegalArgumentException.class,
                () -> ExperienceTable.levelForExperience(ExperienceTable.MAX_EXPERIENCE + 1));
        assertFalse(ExperienceTable.isValidExperience(-5));
        assertThrows(IllegalArgumentException.class, () -> ExperienceTable.experienceForLevel(100));
    }
}
