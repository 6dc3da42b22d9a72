package com.runeledger.service;

import com.runeledger.model.SkillType;

public record SkillUpdateResult(
        Long playerId,
        SkillType skill,
        int previousLevel,
        int newLevel,
        long previousExperience,
        long newExperience,
        int totalLevel,
        int combatLevel
) {
}
