package com.runeledger.arena.service;

import com.runeledger.arena.model.BattleRating;
import com.runeledger.arena.model.BattleRecord;

/**
 * Outcome of {@code recordBattle}. On a replay the rating changes are null and the ratings are the
 * current rows.
 */
public record BattleResult(
        BattleRecord record,
        boolean replayed,
        BattleRating ratingA,
        BattleRating ratingB,
        GlickoRatingCalculator.RatingChange changeA,
        GlickoRatingCalculator.RatingChange changeB
) {
}
