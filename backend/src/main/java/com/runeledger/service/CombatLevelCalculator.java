package com.runeledger.service;

import com.runeledger.model.SkillType;

import java.util.Map;

/**
 * Combat level from the seven combat skills.
 *
 * base   = 0.25 * (defence + hitpoints + floor(prayer / 2))
 * melee  = 0.325 * (attack + strength)
 * ranged = 0.325 * floor(3 * ranged / 2)
 * magic  = 0.325 * floor(3 * magic / 2)
 * combat = floor(base + max(melee, ranged, magic))
 *
 * Evaluated in thousandths so the floor is exact.
 */
public final class CombatLevelCalculator {

    private CombatLevelCalculator() {
    }

    public static int combatLevel(Map<SkillType, Integer> levels) {
        return combatLevel(
                levelOf(levels, SkillType.ATTACK),
                levelOf(levels, SkillType.STRENGTH),
                levelOf(levels, SkillType.DEFENCE),
                levelOf(levels, SkillType.HITPOINTS),
                levelOf(levels, SkillType.PRAYER),
                levelOf(levels, SkillType.RANGED),
                levelOf(levels, SkillType.MAGIC)
        );
    }

    public static int combatLevel(int attack, int strength, int defence, int hitpoints,
                                  int prayer, int ranged, int magic) {
        long base = 250L * (defence + hitpoints + prayer / 2);
        long melee = attack + strength;
        long range = (3L * ranged) / 2;
        long mage = (3L * magic) / 2;
        long best = Math.max(melee, Math.max(range, mage));
        return (int) ((base + 325L * best) / 1000L);
    }

    private static int levelOf(Map<SkillType, Integer> levels, SkillType skill) {
        Integer level = levels == null ? null : levels.get(skill);
        return level != null ? level : skill.getBaselineLevel();
    }
}
