package com.runeledger.model;

/**
 * The 23 trainable skills. Combat-relevant skills feed the combat level formula.
 */
public enum SkillType {
    ATTACK(true, 1),
    DEFENCE(true, 1),
    STRENGTH(true, 1),
    HITPOINTS(true, 10),
    RANGED(true, 1),
    PRAYER(true, 1),
    MAGIC(true, 1),
    COOKING(false, 1),
    WOODCUTTING(false, 1),
    FLETCHING(false, 1),
    FISHING(false, 1),
    FIREMAKING(false, 1),
    CRAFTING(false, 1),
    SMITHING(false, 1),
    MINING(false, 1),
    HERBLORE(false, 1),
    AGILITY(false, 1),
    THIEVING(false, 1),
    SLAYER(false, 1),
    FARMING(false, 1),
    RUNECRAFT(false, 1),
    HUNTER(false, 1),
    CONSTRUCTION(false, 1);

    private final boolean combatRelevant;
    private final int baselineLevel;

    SkillType(boolean combatRelevant, int baselineLevel) {
        this.combatRelevant = combatRelevant;
        this.baselineLevel = baselineLevel;
    }

    public boolean isCombatRelevant() {
        return combatRelevant;
    }

    public int getBaselineLevel() {
        return baselineLevel;
    }
}
