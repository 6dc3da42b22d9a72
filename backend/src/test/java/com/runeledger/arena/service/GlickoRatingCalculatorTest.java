package com.runeledger.arena.service;

import com.runeledger.arena.config.ArenaProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GlickoRatingCalculatorTest {

    private static final double EPSILON = 1e-9;

    private final GlickoRatingCalculator calculator = new GlickoRatingCalculator(new ArenaProperties());

    @Test
    void rate_equalRatingsAtMaxUncertainty_movesByHalfBaseK() {
        GlickoRatingCalculator.RatingChange winner = calculator.rate(1000.0, 350.0, 1000.0, 1.0);
        GlickoRatingCalculator.RatingChange loser = calculator.rate(1000.0, 350.0, 1000.0, 0.0);

        assertEquals(1016.0, winner.newRating(), EPSILON);
        assertEquals(984.0, loser.newRating(), EPSILON);
        assertEquals(332.5, winner.newUncertainty(), EPSILON);
    }

    @Test
    void rate_draw_favoursLowerRatedSide() {
        GlickoRatingCalculator.RatingChange underdog = calculator.rate(900.0, 200.0, 1100.0, 0.5);
        GlickoRatingCalculator.RatingChange favourite = calculator.rate(1100.0, 200.0, 900.0, 0.5);

        assertTrue(underdog.delta() > 0);
        assertTrue(favourite.delta() < 0);
    }

    @Test
    void rate_sumOfDeltasBoundedByKFactorGap() {
        double[][] cases = {
                {1000.0, 350.0, 1000.0, 60.0},
                {1400.0, 80.0, 900.0, 300.0},
                {850.0, 50.0, 1320.0, 200.0},
        };
        for (double[] c : cases) {
            for (double score : new double[]{0.0, 0.5, 1.0}) {
                GlickoRatingCalculator.RatingChange a = calculator.rate(c[0], c[1], c[2], score);
                GlickoRatingCalculator.RatingChange b = calculator.rate(c[2], c[3], c[0], 1.0 - score);

                assertTrue(
                        Math.abs(a.delta() + b.delta()) <= Math.abs(a.kFactor() - b.kFactor()) + EPSILON,
                        "deltas not bounded for " + c[0] + " vs " + c[2] + " score " + score
                );
            }
        }
    }

    @Test
    void kFactor_clampedBetweenMinAndBase() {
        assertEquals(32.0, calculator.kFactor(350.0), EPSILON);
        assertEquals(32.0, calculator.kFactor(900.0), EPSILON);
        assertEquals(16.0, calculator.kFactor(175.0), EPSILON);
        assertEquals(4.0, calculator.kFactor(10.0), EPSILON);
    }

    @Test
    void settledUncertainty_neverDropsBelowFloor() {
        assertEquals(50.0, calculator.settledUncertainty(51.0), EPSILON);
        assertEquals(95.0, calculator.settledUncertainty(100.0), EPSILON);
    }

    @Test
    void idleUncertainty_growsOnlyPastThresholdAndCapsAtCeiling() {
        assertEquals(50.0, calculator.idleUncertainty(50.0, 7), EPSILON);
        assertEquals(Math.sqrt(50.0 * 50.0 + 225.0 * 30), calculator.idleUncertainty(50.0, 30), EPSILON);
        assertEquals(350.0, calculator.idleUncertainty(300.0, 1000), EPSILON);
    }

    @Test
    void idleUncertainty_isPureInItsInputs() {
        double first = calculator.idleUncertainty(120.0, 45);
        double second = calculator.idleUncertainty(120.0, 45);

        assertEquals(first, second, 0.0);
    }
}
