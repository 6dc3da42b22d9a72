package com.runeledger.arena.service;

import com.runeledger.arena.config.ArenaProperties;
import com.runeledger.arena.model.BattleRating;
import com.runeledger.arena.repository.BattleRatingRepository;
import com.runeledger.service.TransactionRetryExecutor;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Grows the uncertainty of players who stopped battling. The new value depends only on the row's
 * post-battle uncertainty, its last battle time and {@code now}, so repeated passes converge and a
 * pass racing a battle never undoes it.
 */
@Service
@RequiredArgsConstructor
public class RatingMaintenanceService {

    private static final Logger log = LoggerFactory.getLogger(RatingMaintenanceService.class);

    private final BattleRatingRepository battleRatingRepository;
    private final GlickoRatingCalculator glickoRatingCalculator;
    private final TransactionRetryExecutor transactionRetryExecutor;
    private final ArenaProperties arenaProperties;

    /**
     * Pages through idle players by ascending id, {@code batchSize} players per transaction.
     */
    public DecaySummary applyInactivityDecay(OffsetDateTime now) {
        int batchSize = Math.max(1, arenaProperties.getMaintenance().getBatchSize());
        OffsetDateTime cutoff = now.minusDays(arenaProperties.getRating().getInactivityThresholdDays());

        long afterPlayerId = 0L;
        int scanned = 0;
        int updated = 0;
        while (true) {
            long cursor = afterPlayerId;
            BatchOutcome batch = transactionRetryExecutor.execute(
                    "applyInactivityDecay",
                    () -> decayBatch(cutoff, cursor, batchSize, now)
            );
            scanned += batch.scanned();
            updated += batch.updated();
            if (batch.players() < batchSize) {
                break;
            }
            afterPlayerId = batch.lastPlayerId();
        }
        return new DecaySummary(scanned, updated);
    }

    private BatchOutcome decayBatch(OffsetDateTime cutoff, long afterPlayerId, int batchSize, OffsetDateTime now) {
        List<Long> playerIds = battleRatingRepository.findIdlePlayerIdsAfter(
                cutoff,
                afterPlayerId,
                PageRequest.of(0, batchSize)
        );
        if (playerIds.isEmpty()) {
            return new BatchOutcome(0, 0, 0, afterPlayerId);
        }
        List<BattleRating> rows = battleRatingRepository.findIdleByPlayerIdsForUpdate(playerIds, cutoff);
        int updated = 0;
        for (BattleRating row : rows) {
            long idleDays = Duration.between(row.getLastBattleAt(), now).toDays();
            double target = glickoRatingCalculator.idleUncertainty(row.getLastBattleUncertainty(), idleDays);
            if (target <= row.getUncertainty()) {
                continue;
            }
            log.debug(
                    "Player {} {} rating idle {} days: uncertainty {} -> {}",
                    row.getPlayerId(),
                    row.getCategory(),
                    idleDays,
                    String.format("%.1f", row.getUncertainty()),
                    String.format("%.1f", target)
            );
            row.setUncertainty(target);
            row.setUpdatedAt(now);
            battleRatingRepository.save(row);
            updated++;
        }
        return new BatchOutcome(playerIds.size(), rows.size(), updated, playerIds.get(playerIds.size() - 1));
    }

    private record BatchOutcome(int players, int scanned, int updated, long lastPlayerId) {
    }

    public record DecaySummary(
            int ratingsScanned,
            int ratingsUpdated
    ) {
        public boolean hasWork() {
            return ratingsUpdated > 0;
        }
    }
}
