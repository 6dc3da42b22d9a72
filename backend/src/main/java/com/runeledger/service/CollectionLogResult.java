package com.runeledger.service;

import java.time.OffsetDateTime;

public record CollectionLogResult(
        Long playerId,
        Integer itemId,
        boolean firstTime,
        boolean replayed,
        long quantityObtained,
        OffsetDateTime firstObtainedAt,
        OffsetDateTime lastObtainedAt
) {
}
