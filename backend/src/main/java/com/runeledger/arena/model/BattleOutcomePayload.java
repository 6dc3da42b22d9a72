package com.runeledger.arena.model;

public record BattleOutcomePayload(
        int turns,
        int durationSeconds,
        CombatantTally participantA,
        CombatantTally participantB,
        String notes
) {
    public static BattleOutcomePayload empty() {
        return new BattleOutcomePayload(0, 0, CombatantTally.NONE, CombatantTally.NONE, null);
    }

    public record CombatantTally(
            long damageDealt,
            long damageTaken
    ) {
        public static final CombatantTally NONE = new CombatantTally(0, 0);
    }
}
