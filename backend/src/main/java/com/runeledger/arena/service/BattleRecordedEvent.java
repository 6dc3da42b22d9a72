package com.runeledger.arena.service;

import com.runeledger.arena.model.BattleRating;
import com.runeledger.arena.model.BattleRecord;

import java.time.OffsetDateTime;

/**
 * Published inside the recording transaction once both rating rows hold their post-battle values.
 */
public record BattleRecordedEvent(
        BattleRecord record,
        BattleRating ratingA,
        BattleRating ratingB,
        OffsetDateTime occurredAt
) {
}
