package com.runeledger.service;

import com.runeledger.model.SkillType;

import java.time.OffsetDateTime;

public record SkillExperienceChangedEvent(
        Long playerId,
        SkillType skill,
        int previousLevel,
        int newLevel,
        long previousExperience,
        long newExperience,
        OffsetDateTime occurredAt
) {
    public boolean levelChanged() {
        return previousLevel != newLevel;
    }
}
