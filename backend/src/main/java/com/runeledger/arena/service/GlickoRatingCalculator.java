package com.runeledger.arena.service;

import com.runeledger.arena.config.ArenaProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Uncertainty-weighted Elo. The K factor scales with the player's uncertainty, so new or returning
 * players move faster than settled ones.
 *
 * Formula: E_X = 1 / (1 + 10^((R_Y - R_X) / 400)), R'_X = R_X + K_X * (S_X - E_X)
 */
@Component
@RequiredArgsConstructor
public class GlickoRatingCalculator {

    private final ArenaProperties arenaProperties;

    public double expectedScore(double rating, double opponentRating) {
        return 1.0 / (1.0 + Math.pow(10.0, (opponentRating - rating) / 400.0));
    }

    /**
     * baseK * uncertainty / maxUncertainty, clamped to [minK, baseK].
     */
    public double kFactor(double uncertainty) {
        ArenaProperties.Rating rating = arenaProperties.getRating();
        double kFactor = rating.getBaseKFactor() * uncertainty / rating.getMaxUncertainty();
        return Math.max(rating.getMinKFactor(), Math.min(kFactor, rating.getBaseKFactor()));
    }

    /**
     * Rates one side of a battle. Both sides must be rated from their pre-battle values.
     *
     * @param score 1.0 for a win, 0.5 for a draw, 0.0 for a loss
     */
    public RatingChange rate(double rating, double uncertainty, double opponentRating, double score) {
        double expected = expectedScore(rating, opponentRating);
        double kFactor = kFactor(uncertainty);
        double delta = kFactor * (score - expected);
        return new RatingChange(
                rating,
                rating + delta,
                delta,
                kFactor,
                uncertainty,
                settledUncertainty(uncertainty)
        );
    }

    /**
     * Uncertainty after one more battle: max(floor, u * decayFactor).
     */
    public double settledUncertainty(double uncertainty) {
        ArenaProperties.Rating rating = arenaProperties.getRating();
        return Math.max(rating.getMinUncertainty(), uncertainty * rating.getUncertaintyDecayFactor());
    }

    /**
     * Uncertainty after {@code idleDays} without a battle: min(ceiling, sqrt(u^2 + c^2 * idleDays))
     * once the threshold is passed, otherwise the post-battle value unchanged.
     */
    public double idleUncertainty(double lastBattleUncertainty, long idleDays) {
        ArenaProperties.Rating rating = arenaProperties.getRating();
        if (idleDays <= rating.getInactivityThresholdDays()) {
            return lastBattleUncertainty;
        }
        double growth = rating.getInactivityGrowthPerDay();
        double grown = Math.sqrt(lastBattleUncertainty * lastBattleUncertainty + growth * growth * idleDays);
        return Math.min(rating.getMaxUncertainty(), grown);
    }

    public record RatingChange(
            double previousRating,
            double newRating,
            double delta,
            double kFactor,
            double previousUncertainty,
            double newUncertainty
    ) {
    }
}
