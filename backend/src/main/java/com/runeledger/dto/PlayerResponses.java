package com.runeledger.dto;

import com.runeledger.model.BattleCategory;
import com.runeledger.model.GameMode;
import com.runeledger.model.PlayerStatus;
import com.runeledger.model.SkillType;

import java.time.OffsetDateTime;
import java.util.List;

public final class PlayerResponses {

    private PlayerResponses() {
    }

    public record Player(
            Long playerId,
            Long accountId,
            String displayName,
            Integer world,
            boolean member,
            GameMode gameMode,
            PlayerStatus status,
            long coins,
            Integer totalLevel,
            Integer combatLevel,
            Integer questPoints,
            OffsetDateTime createdAt,
            OffsetDateTime updatedAt,
            OffsetDateTime lastLoginAt
    ) {
    }

    public record Skill(
            SkillType skill,
            Integer level,
            Long experience,
            OffsetDateTime lastTrainedAt
    ) {
    }

    public record SkillUpdate(
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

    public record Rating(
            BattleCategory category,
            Double rating,
            Double uncertainty,
            Integer wins,
            Integer losses,
            Integer draws,
            Integer winStreak,
            Integer highestWinStreak
    ) {
    }

    public record Snapshot(
            Player player,
            List<Skill> skills,
            List<LedgerResponses.Slot> inventory,
            List<LedgerResponses.Slot> bank,
            List<LedgerResponses.Equipment> equipment,
            List<Rating> ratings,
            List<ProgressionResponses.EarnedAchievement> achievements,
            List<ProgressionResponses.CompletedQuest> quests,
            List<ProgressionResponses.CollectionEntry> collectionLog
    ) {
    }

    public record PurgeReport(
            Long playerId,
            List<StoreDeletion> deletions,
            int totalRowsDeleted
    ) {
        public record StoreDeletion(
                String store,
                int rowsDeleted
        ) {
        }
    }
}
