package com.runeledger.service;

import com.runeledger.model.CollectionLogDrop;
import com.runeledger.model.CollectionLogEntry;
import com.runeledger.repository.CollectionLogDropRepository;
import com.runeledger.repository.CollectionLogEntryRepository;
import com.runeledger.repository.ItemDefinitionRepository;
import com.runeledger.repository.PlayerRepository;
import com.runeledger.web.GameStateException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.OffsetDateTime;
import java.util.List;

@Service
@RequiredArgsConstructor
public class CollectionLogService {

    private static final Logger log = LoggerFactory.getLogger(CollectionLogService.class);

    static final int MAX_DROP_KEY_LENGTH = 128;

    private final CollectionLogEntryRepository collectionLogEntryRepository;
    private final CollectionLogDropRepository collectionLogDropRepository;
    private final ItemDefinitionRepository itemDefinitionRepository;
    private final PlayerRepository playerRepository;
    private final TransactionRetryExecutor transactionRetryExecutor;

    /**
     * Records that a player obtained an item. The first-obtained timestamp is written once and the
     * cumulative quantity grows once per {@code dropKey}; replaying a key returns the current entry.
     */
    public CollectionLogResult recordObtained(Long playerId, Integer itemId, long quantity, String dropKey) {
        if (quantity <= 0) {
            throw GameStateException.validation("INVALID_QUANTITY", "quantity must be positive");
        }
        if (!StringUtils.hasText(dropKey) || dropKey.length() > MAX_DROP_KEY_LENGTH) {
            throw GameStateException.validation(
                    "INVALID_DROP_KEY",
                    "dropKey is required and must be at most " + MAX_DROP_KEY_LENGTH + " characters"
            );
        }
        return transactionRetryExecutor.execute("recordCollectionEntry", () -> {
            playerRepository.findByIdForUpdate(playerId)
                    .orElseThrow(() -> GameStateException.playerNotFound(playerId));
            if (!itemDefinitionRepository.existsById(itemId)) {
                throw GameStateException.itemNotFound(itemId);
            }

            CollectionLogDrop applied = collectionLogDropRepository.findByPlayerIdAndDropKey(playerId, dropKey)
                    .orElse(null);
            if (applied != null) {
                return replay(applied, itemId, quantity);
            }

            OffsetDateTime now = OffsetDateTime.now();
            CollectionLogEntry existing = collectionLogEntryRepository.findByPlayerIdAndItemId(playerId, itemId)
                    .orElse(null);
            CollectionLogDrop drop = new CollectionLogDrop();
            drop.setPlayerId(playerId);
            drop.setDropKey(dropKey);
            drop.setItemId(itemId);
            drop.setQuantity(quantity);
            drop.setRecordedAt(now);
            collectionLogDropRepository.save(drop);
            collectionLogEntryRepository.upsertObtained(playerId, itemId, quantity, now);

            if (existing == null) {
                log.info("Player {} logged item {} for the first time", playerId, itemId);
                return new CollectionLogResult(playerId, itemId, true, false, quantity, now, now);
            }
            return new CollectionLogResult(
                    playerId,
                    itemId,
                    false,
                    false,
                    existing.getQuantityObtained() + quantity,
                    existing.getFirstObtainedAt(),
                    now
            );
        });
    }

    @Transactional(readOnly = true)
    public List<CollectionLogEntry> listEntries(Long playerId) {
        return collectionLogEntryRepository.findByPlayerIdOrderByFirstObtainedAtAscIdAsc(playerId);
    }

    private CollectionLogResult replay(CollectionLogDrop applied, Integer itemId, long quantity) {
        if (!applied.getItemId().equals(itemId) || applied.getQuantity() != quantity) {
            throw GameStateException.dropKeyConflict(
                    "Drop key " + applied.getDropKey() + " was already used for " + applied.getQuantity()
                            + " of item " + applied.getItemId()
            );
        }
        CollectionLogEntry entry = collectionLogEntryRepository
                .findByPlayerIdAndItemId(applied.getPlayerId(), itemId)
                .orElseThrow(() -> GameStateException.invariantViolation(
                        "COLLECTION_LOG_MISSING",
                        "Drop key " + applied.getDropKey() + " has no collection log entry"
                ));
        log.debug("Drop key {} of player {} replayed", applied.getDropKey(), applied.getPlayerId());
        return new CollectionLogResult(
                applied.getPlayerId(),
                itemId,
                false,
                true,
                entry.getQuantityObtained(),
                entry.getFirstObtainedAt(),
                entry.getLastObtainedAt()
        );
    }
}
