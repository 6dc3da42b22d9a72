package com.runeledger.arena.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.runeledger.arena.model.BattleOutcome;
import com.runeledger.model.BattleCategory;

import java.time.OffsetDateTime;

/**
 * @param battleKey caller-chosen idempotency key; replaying it returns the stored record
 * @param tournamentMatchId optional scheduled tournament match this battle decides
 */
public record RecordBattleCommand(
        String battleKey,
        BattleCategory category,
        Long participantAId,
        Long participantBId,
        BattleOutcome outcome,
        JsonNode outcomePayload,
        Long tournamentMatchId,
        OffsetDateTime startedAt
) {
}
