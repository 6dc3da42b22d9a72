package com.runeledger.service;

import com.runeledger.model.SkillType;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CombatLevelCalculatorTest {

    @Test
    void combatLevel_fiftiesInMeleeSkills_floorsToSixtyThree() {
        // 0.25 * 125 + 0.325 * 100 = 63.75
        assertEquals(63, CombatLevelCalculator.combatLevel(50, 50, 50, 50, 50, 1, 1));
    }

    @Test
    void combatLevel_freshAccount_isThree() {
        assertEquals(3, CombatLevelCalculator.combatLevel(1, 1, 1, 10, 1, 1, 1));
        assertEquals(3, CombatLevelCalculator.combatLevel(Map.of()));
    }

    @Test
    void combatLevel_maxedAccount_is126() {
        assertEquals(126, CombatLevelCalculator.combatLevel(99, 99, 99, 99, 99, 99, 99));
    }

    @Test
    void combatLevel_usesBestOfMeleeRangedMagic() {
        // base 2.75, ranged 0.325 * 148 = 48.1
        assertEquals(50, CombatLevelCalculator.combatLevel(1, 1, 1, 10, 1, 99, 1));
        assertEquals(50, CombatLevelCalculator.combatLevel(1, 1, 1, 10, 1, 1, 99));
    }

    @Test
    void combatLevel_missingSkillsUseBaselines() {
        Map<SkillType, Integer> levels = new EnumMap<>(SkillType.class);
        levels.put(SkillType.ATTACK, 50);
        levels.put(SkillType.STRENGTH, 50);
        levels.put(SkillType.DEFENCE, 50);
        levels.put(SkillType.PRAYER, 50);

        // hitpoints falls back to 10: 0.25 * (50 + 10 + 25) + 0.325 * 100 = 53.75
        assertEquals(53, CombatLevelCalculator.combatLevel(levels));
    }
}
