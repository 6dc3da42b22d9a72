package com.runeledger.service;

/**
 * A player's post-battle counters in one battle category, as seen by the achievement ledger.
 */
public record BattleStatLine(
        int wins,
        int winStreak,
        int highestWinStreak,
        int totalBattles
) {
}
