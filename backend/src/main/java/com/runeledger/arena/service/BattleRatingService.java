package com.runeledger.arena.service;

import com.runeledger.arena.config.ArenaProperties;
import com.runeledger.arena.model.BattleOutcome;
import com.runeledger.arena.model.BattleOutcomePayload;
import com.runeledger.arena.model.BattleOutcomePayloadJsonCodec;
import com.runeledger.arena.model.BattleRating;
import com.runeledger.arena.model.BattleRecord;
import com.runeledger.arena.model.TournamentMatch;
import com.runeledger.arena.repository.BattleRatingRepository;
import com.runeledger.arena.repository.BattleRecordRepository;
import com.runeledger.model.BattleCategory;
import com.runeledger.model.Player;
import com.runeledger.repository.PlayerRepository;
import com.runeledger.service.PlayerService;
import com.runeledger.service.TransactionRetryExecutor;
import com.runeledger.web.GameStateException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Records battles and moves both participants' ratings in one transaction. Rating rows are locked
 * in ascending player id order; a replayed battle key returns the stored record untouched.
 */
@Service
@RequiredArgsConstructor
public class BattleRatingService {

    private static final Logger log = LoggerFactory.getLogger(BattleRatingService.class);
    private static final int MAX_BATTLE_KEY_LENGTH = 128;
    private static final int MAX_LEADERBOARD_SIZE = 100;

    private final BattleRecordRepository battleRecordRepository;
    private final BattleRatingRepository battleRatingRepository;
    private final PlayerRepository playerRepository;
    private final TournamentService tournamentService;
    private final GlickoRatingCalculator glickoRatingCalculator;
    private final ApplicationEventPublisher eventPublisher;
    private final TransactionRetryExecutor transactionRetryExecutor;
    private final ArenaProperties arenaProperties;

    public BattleResult recordBattle(RecordBattleCommand command) {
        validate(command);
        BattleOutcomePayload payload = parsePayload(command);

        // A concurrent insert of the same key loses on the unique index and replays on retry.
        return transactionRetryExecutor.execute(
                "recordBattle",
                () -> recordInTransaction(command, payload),
                List.of(DataIntegrityViolationException.class)
        );
    }

    @Transactional(readOnly = true)
    public BattleRecord getBattle(Long battleId) {
        return battleRecordRepository.findById(battleId)
                .orElseThrow(() -> GameStateException.notFound("BATTLE_NOT_FOUND", "Battle not found: " + battleId));
    }

    @Transactional(readOnly = true)
    public List<BattleRecord> listRecentBattles(Long playerId) {
        return battleRecordRepository.findTop50ByParticipantAIdOrParticipantBIdOrderByRecordedAtDescIdDesc(playerId, playerId);
    }

    @Transactional(readOnly = true)
    public List<BattleRating> listRatings(Long playerId) {
        return battleRatingRepository.findByPlayerIdOrderByCategoryAsc(playerId);
    }

    @Transactional(readOnly = true)
    public List<BattleRating> leaderboard(BattleCategory category, int limit) {
        if (category == null) {
            throw GameStateException.validation("CATEGORY_REQUIRED", "category is required");
        }
        int size = Math.max(1, Math.min(limit, MAX_LEADERBOARD_SIZE));
        return battleRatingRepository.findByCategoryOrderByRatingDescPlayerIdAsc(category, PageRequest.of(0, size));
    }

    private BattleResult recordInTransaction(RecordBattleCommand command, BattleOutcomePayload payload) {
        BattleRecord existing = battleRecordRepository.findByBattleKey(command.battleKey()).orElse(null);
        if (existing != null) {
            return replay(existing, command);
        }

        requireActivePlayer(command.participantAId());
        requireActivePlayer(command.participantBId());

        TournamentMatch match = null;
        if (command.tournamentMatchId() != null) {
            match = tournamentService.lockMatchForResult(
                    command.tournamentMatchId(),
                    command.category(),
                    command.participantAId(),
                    command.participantBId(),
                    command.outcome()
            );
        }

        OffsetDateTime now = OffsetDateTime.now();
        BattleRating ratingA;
        BattleRating ratingB;
        if (command.participantAId() < command.participantBId()) {
            ratingA = lockRating(command.participantAId(), command.category());
            ratingB = lockRating(command.participantBId(), command.category());
        } else {
            ratingB = lockRating(command.participantBId(), command.category());
            ratingA = lockRating(command.participantAId(), command.category());
        }

        double scoreA = command.outcome().scoreForA();
        GlickoRatingCalculator.RatingChange changeA = glickoRatingCalculator.rate(
                ratingA.getRating(), ratingA.getUncertainty(), ratingB.getRating(), scoreA
        );
        GlickoRatingCalculator.RatingChange changeB = glickoRatingCalculator.rate(
                ratingB.getRating(), ratingB.getUncertainty(), ratingA.getRating(), 1.0 - scoreA
        );
        applyResult(ratingA, changeA, scoreA, payload.participantA(), now);
        applyResult(ratingB, changeB, 1.0 - scoreA, payload.participantB(), now);
        battleRatingRepository.save(ratingA);
        battleRatingRepository.save(ratingB);

        BattleRecord record = new BattleRecord();
        record.setBattleKey(command.battleKey());
        record.setCategory(command.category());
        record.setParticipantAId(command.participantAId());
        record.setParticipantBId(command.participantBId());
        record.setOutcome(command.outcome());
        record.setWinnerId(winnerOf(command));
        record.setTurns(payload.turns());
        record.setDurationSeconds(payload.durationSeconds());
        record.setTournamentMatchId(command.tournamentMatchId());
        record.setOutcomePayload(BattleOutcomePayloadJsonCodec.toJson(payload));
        record.setStartedAt(command.startedAt());
        record.setRecordedAt(now);
        BattleRecord saved = battleRecordRepository.saveAndFlush(record);

        if (match != null) {
            tournamentService.completeMatch(match, saved.getWinnerId(), saved.getId(), now);
        }

        log.info(
                "Recorded {} battle {} ({}): player {} {} -> {}, player {} {} -> {}",
                command.category(),
                saved.getId(),
                command.outcome(),
                ratingA.getPlayerId(),
                String.format("%.1f", changeA.previousRating()),
                String.format("%.1f", changeA.newRating()),
                ratingB.getPlayerId(),
                String.format("%.1f", changeB.previousRating()),
                String.format("%.1f", changeB.newRating())
        );

        eventPublisher.publishEvent(new BattleRecordedEvent(saved, ratingA, ratingB, now));
        return new BattleResult(saved, false, ratingA, ratingB, changeA, changeB);
    }

    private BattleResult replay(BattleRecord existing, RecordBattleCommand command) {
        boolean sameBattle = existing.getCategory() == command.category()
                && Objects.equals(existing.getParticipantAId(), command.participantAId())
                && Objects.equals(existing.getParticipantBId(), command.participantBId())
                && existing.getOutcome() == command.outcome();
        if (!sameBattle) {
            throw GameStateException.battleKeyConflict(
                    "Battle key " + command.battleKey() + " was already used for a different battle"
            );
        }
        log.debug("Battle key {} replayed; returning record {}", command.battleKey(), existing.getId());
        return new BattleResult(
                existing,
                true,
                battleRatingRepository.findByPlayerIdAndCategory(existing.getParticipantAId(), existing.getCategory()).orElse(null),
                battleRatingRepository.findByPlayerIdAndCategory(existing.getParticipantBId(), existing.getCategory()).orElse(null),
                null,
                null
        );
    }

    private void applyResult(
            BattleRating rating,
            GlickoRatingCalculator.RatingChange change,
            double score,
            BattleOutcomePayload.CombatantTally tally,
            OffsetDateTime now
    ) {
        rating.setRating(change.newRating());
        rating.setUncertainty(change.newUncertainty());
        rating.setLastBattleUncertainty(change.newUncertainty());
        rating.setTotalBattles(rating.getTotalBattles() + 1);
        if (score == 1.0) {
            rating.setWins(rating.getWins() + 1);
            rating.setWinStreak(rating.getWinStreak() + 1);
            rating.setLossStreak(0);
            rating.setHighestWinStreak(Math.max(rating.getHighestWinStreak(), rating.getWinStreak()));
        } else if (score == 0.0) {
            rating.setLosses(rating.getLosses() + 1);
            rating.setLossStreak(rating.getLossStreak() + 1);
            rating.setWinStreak(0);
        } else {
            // Draws leave both streaks alone.
            rating.setDraws(rating.getDraws() + 1);
        }
        rating.setTotalDamageDealt(rating.getTotalDamageDealt() + tally.damageDealt());
        rating.setTotalDamageTaken(rating.getTotalDamageTaken() + tally.damageTaken());
        rating.setLastBattleAt(now);
        rating.setUpdatedAt(now);
    }

    private BattleRating lockRating(Long playerId, BattleCategory category) {
        ArenaProperties.Rating defaults = arenaProperties.getRating();
        battleRatingRepository.insertIfAbsent(
                playerId,
                category.name(),
                defaults.getInitialRating(),
                defaults.getInitialUncertainty()
        );
        return battleRatingRepository.findByPlayerIdAndCategoryForUpdate(playerId, category)
                .orElseThrow(() -> GameStateException.invariantViolation(
                        "RATING_ROW_MISSING",
                        "No " + category + " rating row for player " + playerId
                ));
    }

    private void requireActivePlayer(Long playerId) {
        Player player = playerRepository.findById(playerId)
                .orElseThrow(() -> GameStateException.playerNotFound(playerId));
        PlayerService.requireActive(player);
    }

    private static Long winnerOf(RecordBattleCommand command) {
        return switch (command.outcome()) {
            case PARTICIPANT_A_WON -> command.participantAId();
            case PARTICIPANT_B_WON -> command.participantBId();
            case DRAW -> null;
        };
    }

    private static void validate(RecordBattleCommand command) {
        if (!StringUtils.hasText(command.battleKey()) || command.battleKey().length() > MAX_BATTLE_KEY_LENGTH) {
            throw GameStateException.validation(
                    "INVALID_BATTLE_KEY",
                    "battleKey is required and must be at most " + MAX_BATTLE_KEY_LENGTH + " characters"
            );
        }
        if (command.category() == null) {
            throw GameStateException.validation("CATEGORY_REQUIRED", "category is required");
        }
        if (command.outcome() == null) {
            throw GameStateException.validation("OUTCOME_REQUIRED", "outcome is required");
        }
        if (command.participantAId() == null || command.participantBId() == null) {
            throw GameStateException.validation("PARTICIPANT_REQUIRED", "both participants are required");
        }
        if (command.participantAId().equals(command.participantBId())) {
            throw GameStateException.validation("SAME_PARTICIPANT", "A player cannot battle themselves");
        }
    }

    private static BattleOutcomePayload parsePayload(RecordBattleCommand command) {
        try {
            return BattleOutcomePayloadJsonCodec.fromJson(command.outcomePayload());
        } catch (IllegalArgumentException ex) {
            throw GameStateException.validation("INVALID_OUTCOME_PAYLOAD", ex.getMessage());
        }
    }
}
