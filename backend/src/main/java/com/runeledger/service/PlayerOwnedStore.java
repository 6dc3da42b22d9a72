package com.runeledger.service;

/**
 * A table whose rows belong to one player and are removed when that player is purged.
 * Stores are purged in ascending {@link #purgeOrder()}, children before the player row.
 */
public interface PlayerOwnedStore {

    String storeName();

    int purgeOrder();

    int deleteOwnedBy(Long playerId);
}
