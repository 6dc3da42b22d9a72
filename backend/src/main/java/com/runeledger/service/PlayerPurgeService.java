package com.runeledger.service;

import com.runeledger.repository.PlayerRepository;
import com.runeledger.web.GameStateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Hard-deletes a player by walking the registered {@link PlayerOwnedStore}s and then the player row,
 * all in one transaction. Catalog rows and history (trades, battle records, tournaments) stay.
 */
@Service
public class PlayerPurgeService {

    private static final Logger log = LoggerFactory.getLogger(PlayerPurgeService.class);

    private final PlayerRepository playerRepository;
    private final List<PlayerOwnedStore> stores;
    private final TransactionRetryExecutor transactionRetryExecutor;

    public PlayerPurgeService(
            PlayerRepository playerRepository,
            List<PlayerOwnedStore> stores,
            TransactionRetryExecutor transactionRetryExecutor
    ) {
        this.playerRepository = playerRepository;
        this.stores = stores.stream()
                .sorted(Comparator.comparingInt(PlayerOwnedStore::purgeOrder))
                .toList();
        this.transactionRetryExecutor = transactionRetryExecutor;
    }

    public PlayerPurgeReport purgePlayer(Long playerId) {
        return transactionRetryExecutor.execute("purgePlayer", () -> {
            playerRepository.findByIdForUpdate(playerId)
                    .orElseThrow(() -> GameStateException.playerNotFound(playerId));

            List<PlayerPurgeReport.StoreDeletion> deletions = new ArrayList<>(stores.size() + 1);
            int total = 0;
            for (PlayerOwnedStore store : stores) {
                int deleted = store.deleteOwnedBy(playerId);
                deletions.add(new PlayerPurgeReport.StoreDeletion(store.storeName(), deleted));
                total += deleted;
            }
            int playerRows = playerRepository.deletePlayerById(playerId);
            deletions.add(new PlayerPurgeReport.StoreDeletion("players", playerRows));
            total += playerRows;

            log.info("Purged player {}: {} rows across {} stores", playerId, total, deletions.size());
            return new PlayerPurgeReport(playerId, List.copyOf(deletions), total);
        });
    }
}
