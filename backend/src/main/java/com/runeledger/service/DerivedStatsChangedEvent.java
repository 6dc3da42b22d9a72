package com.runeledger.service;

import java.time.OffsetDateTime;

public record DerivedStatsChangedEvent(
        Long playerId,
        int totalLevel,
        int combatLevel,
        OffsetDateTime occurredAt
) {
}
