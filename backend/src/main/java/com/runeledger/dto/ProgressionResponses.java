package com.runeledger.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.runeledger.model.AchievementCategory;
import com.runeledger.model.AchievementCriterion;
import com.runeledger.model.BattleCategory;
import com.runeledger.model.QuestDifficulty;

import java.time.OffsetDateTime;

public final class ProgressionResponses {

    private ProgressionResponses() {
    }

    public record CollectionEntry(
            Integer itemId,
            Long quantityObtained,
            OffsetDateTime firstObtainedAt,
            OffsetDateTime lastObtainedAt
    ) {
    }

    public record ObtainedOutcome(
            Long playerId,
            Integer itemId,
            boolean firstTime,
            boolean replayed,
            long quantityObtained,
            OffsetDateTime firstObtainedAt,
            OffsetDateTime lastObtainedAt
    ) {
    }

    public record Quest(
            Integer questId,
            String name,
            QuestDifficulty difficulty,
            Integer questPoints,
            JsonNode requirements
    ) {
    }

    public record CompletedQuest(
            Integer questId,
            OffsetDateTime completedAt
    ) {
    }

    public record QuestCompletion(
            Long playerId,
            Integer questId,
            boolean newlyCompleted,
            int questPointsAwarded,
            int questPointsTotal
    ) {
    }

    public record Achievement(
            Integer achievementId,
            String code,
            String name,
            String description,
            AchievementCategory category,
            BattleCategory battleCategory,
            AchievementCriterion criterion,
            Integer threshold,
            Integer points
    ) {
    }

    public record EarnedAchievement(
            Integer achievementId,
            OffsetDateTime completedAt
    ) {
    }
}
