package com.runeledger.service;

public record QuestCompletionResult(
        Long playerId,
        Integer questId,
        boolean newlyCompleted,
        int questPointsAwarded,
        int questPointsTotal
) {
}
