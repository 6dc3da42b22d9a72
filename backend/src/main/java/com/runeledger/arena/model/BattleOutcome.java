package com.runeledger.arena.model;

public enum BattleOutcome {
    PARTICIPANT_A_WON,
    PARTICIPANT_B_WON,
    DRAW;

    /**
     * Score of participant A: 1 for a win, 0.5 for a draw, 0 for a loss.
     */
    public double scoreForA() {
        return switch (this) {
            case PARTICIPANT_A_WON -> 1.0;
            case PARTICIPANT_B_WON -> 0.0;
            case DRAW -> 0.5;
        };
    }
}
