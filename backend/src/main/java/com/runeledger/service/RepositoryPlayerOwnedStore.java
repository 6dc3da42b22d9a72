package com.runeledger.service;

import java.util.function.ToIntFunction;

public record RepositoryPlayerOwnedStore(
        String storeName,
        int purgeOrder,
        ToIntFunction<Long> deleter
) implements PlayerOwnedStore {

    @Override
    public int deleteOwnedBy(Long playerId) {
        return deleter.applyAsInt(playerId);
    }
}
