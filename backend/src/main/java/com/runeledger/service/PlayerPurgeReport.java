package com.runeledger.service;

import java.util.List;

public record PlayerPurgeReport(
        Long playerId,
        List<StoreDeletion> deletions,
        int totalRowsDeleted
) {
    public record StoreDeletion(
            String storeName,
            int rowsDeleted
    ) {
    }
}
