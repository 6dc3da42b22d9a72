package com.runeledger.arena.service;

import com.runeledger.arena.config.ArenaProperties;
import com.runeledger.arena.model.BattleOutcome;
import com.runeledger.arena.model.BattleRating;
import com.runeledger.arena.model.Tournament;
import com.runeledger.arena.model.TournamentMatch;
import com.runeledger.arena.model.TournamentMatchStatus;
import com.runeledger.arena.model.TournamentParticipant;
import com.runeledger.arena.model.TournamentStatus;
import com.runeledger.arena.repository.BattleRatingRepository;
import com.runeledger.arena.repository.TournamentMatchRepository;
import com.runeledger.arena.repository.TournamentParticipantRepository;
import com.runeledger.arena.repository.TournamentRepository;
import com.runeledger.model.BattleCategory;
import com.runeledger.model.Player;
import com.runeledger.repository.PlayerRepository;
import com.runeledger.service.PlayerService;
import com.runeledger.service.TransactionRetryExecutor;
import com.runeledger.web.GameStateException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Single-elimination brackets. Every bracket mutation locks the tournament row first and the match
 * row second, so round advancement and result recording never interleave.
 */
@Service
@RequiredArgsConstructor
public class TournamentService {

    private static final Logger log = LoggerFactory.getLogger(TournamentService.class);
    private static final int MAX_NAME_LENGTH = 128;
    private static final int MAX_PARTICIPANTS_CEILING = 1024;

    private final TournamentRepository tournamentRepository;
    private final TournamentParticipantRepository tournamentParticipantRepository;
    private final TournamentMatchRepository tournamentMatchRepository;
    private final BattleRatingRepository battleRatingRepository;
    private final PlayerRepository playerRepository;
    private final TournamentBracketPlanner tournamentBracketPlanner;
    private final TransactionRetryExecutor transactionRetryExecutor;
    private final ArenaProperties arenaProperties;

    public Tournament createTournament(String name, BattleCategory category, Integer maxParticipants) {
        if (!StringUtils.hasText(name) || name.trim().length() > MAX_NAME_LENGTH) {
            throw GameStateException.validation(
                    "INVALID_TOURNAMENT_NAME",
                    "name is required and must be at most " + MAX_NAME_LENGTH + " characters"
            );
        }
        if (category == null) {
            throw GameStateException.validation("CATEGORY_REQUIRED", "category is required");
        }
        int minParticipants = arenaProperties.getTournament().getMinParticipants();
        int capacity = maxParticipants != null
                ? maxParticipants
                : arenaProperties.getTournament().getDefaultMaxParticipants();
        if (capacity < minParticipants || capacity > MAX_PARTICIPANTS_CEILING) {
            throw GameStateException.validation(
                    "INVALID_CAPACITY",
                    "maxParticipants must be between " + minParticipants + " and " + MAX_PARTICIPANTS_CEILING
            );
        }

        return transactionRetryExecutor.execute("createTournament", () -> {
            OffsetDateTime now = OffsetDateTime.now();
            Tournament tournament = new Tournament();
            tournament.setName(name.trim());
            tournament.setCategory(category);
            tournament.setMaxParticipants(capacity);
            tournament.setCreatedAt(now);
            tournament.setUpdatedAt(now);
            Tournament saved = tournamentRepository.save(tournament);
            log.info("Created {} tournament {} '{}' (capacity {})", category, saved.getId(), saved.getName(), capacity);
            return saved;
        });
    }

    public TournamentParticipant registerParticipant(Long tournamentId, Long playerId) {
        return transactionRetryExecutor.execute("registerParticipant", () -> {
            Tournament tournament = lockTournament(tournamentId);
            if (tournament.getStatus() != TournamentStatus.PENDING) {
                throw GameStateException.tournamentConflict(
                        "TOURNAMENT_NOT_OPEN",
                        "Tournament " + tournamentId + " is " + tournament.getStatus()
                );
            }
            Player player = playerRepository.findById(playerId)
                    .orElseThrow(() -> GameStateException.playerNotFound(playerId));
            PlayerService.requireActive(player);
            if (tournamentParticipantRepository.existsByTournamentIdAndPlayerId(tournamentId, playerId)) {
                throw GameStateException.tournamentConflict(
                        "ALREADY_REGISTERED",
                        "Player " + playerId + " is already registered for tournament " + tournamentId
                );
            }
            if (tournamentParticipantRepository.countByTournamentId(tournamentId) >= tournament.getMaxParticipants()) {
                throw GameStateException.tournamentConflict(
                        "TOURNAMENT_FULL",
                        "Tournament " + tournamentId + " already has " + tournament.getMaxParticipants() + " participants"
                );
            }

            TournamentParticipant participant = new TournamentParticipant();
            participant.setTournamentId(tournamentId);
            participant.setPlayerId(playerId);
            participant.setRegisteredAt(OffsetDateTime.now());
            TournamentParticipant saved = tournamentParticipantRepository.save(participant);
            log.info("Player {} registered for tournament {}", playerId, tournamentId);
            return saved;
        });
    }

    /**
     * Starts the bracket from PENDING, or opens the next round once every match of the current
     * round is COMPLETED.
     */
    public TournamentBracket advanceTournamentRound(Long tournamentId) {
        return transactionRetryExecutor.execute("advanceTournamentRound", () -> {
            Tournament tournament = lockTournament(tournamentId);
            OffsetDateTime now = OffsetDateTime.now();
            switch (tournament.getStatus()) {
                case PENDING -> startBracket(tournament, now);
                case IN_PROGRESS -> openNextRound(tournament, now);
                case COMPLETED -> throw GameStateException.tournamentConflict(
                        "TOURNAMENT_COMPLETED",
                        "Tournament " + tournamentId + " is already completed"
                );
            }
            return readBracket(tournament);
        });
    }

    public TournamentMatch scheduleMatch(Long matchId, OffsetDateTime scheduledAt) {
        return transactionRetryExecutor.execute("scheduleMatch", () -> {
            Long tournamentId = tournamentMatchRepository.findTournamentIdById(matchId)
                    .orElseThrow(() -> matchNotFound(matchId));
            Tournament tournament = lockTournament(tournamentId);
            TournamentMatch match = tournamentMatchRepository.findByIdForUpdate(matchId)
                    .orElseThrow(() -> matchNotFound(matchId));
            requireInProgress(tournament);
            if (match.getStatus() != TournamentMatchStatus.PENDING) {
                throw GameStateException.tournamentConflict(
                        "MATCH_NOT_PENDING",
                        "Match " + matchId + " is " + match.getStatus()
                );
            }

            OffsetDateTime now = OffsetDateTime.now();
            match.setStatus(TournamentMatchStatus.SCHEDULED);
            match.setScheduledAt(scheduledAt != null ? scheduledAt : now);
            match.setUpdatedAt(now);
            log.info("Scheduled match {} of tournament {} at {}", matchId, tournamentId, match.getScheduledAt());
            return tournamentMatchRepository.save(match);
        });
    }

    /**
     * Locks a scheduled match for result recording. Must run inside the caller's transaction.
     */
    public TournamentMatch lockMatchForResult(
            Long matchId,
            BattleCategory category,
            Long participantAId,
            Long participantBId,
            BattleOutcome outcome
    ) {
        Long tournamentId = tournamentMatchRepository.findTournamentIdById(matchId)
                .orElseThrow(() -> matchNotFound(matchId));
        Tournament tournament = lockTournament(tournamentId);
        TournamentMatch match = tournamentMatchRepository.findByIdForUpdate(matchId)
                .orElseThrow(() -> matchNotFound(matchId));

        requireInProgress(tournament);
        if (tournament.getCategory() != category) {
            throw GameStateException.validation(
                    "CATEGORY_MISMATCH",
                    "Tournament " + tournamentId + " is a " + tournament.getCategory() + " tournament"
            );
        }
        if (outcome == BattleOutcome.DRAW) {
            throw GameStateException.validation("DRAW_NOT_ALLOWED", "Tournament matches cannot end in a draw");
        }
        if (match.isBye()) {
            throw GameStateException.tournamentConflict("MATCH_IS_BYE", "Match " + matchId + " is a bye");
        }
        if (!match.getRound().equals(tournament.getCurrentRound())) {
            throw GameStateException.tournamentConflict(
                    "MATCH_NOT_IN_CURRENT_ROUND",
                    "Match " + matchId + " belongs to round " + match.getRound()
                            + " but the tournament is in round " + tournament.getCurrentRound()
            );
        }
        if (match.getStatus() != TournamentMatchStatus.SCHEDULED) {
            throw GameStateException.tournamentConflict(
                    "MATCH_NOT_SCHEDULED",
                    "Match " + matchId + " is " + match.getStatus()
            );
        }
        if (!match.involves(participantAId) || !match.involves(participantBId)) {
            throw GameStateException.validation(
                    "MATCH_PARTICIPANT_MISMATCH",
                    "Players " + participantAId + " and " + participantBId + " are not the entrants of match " + matchId
            );
        }
        return match;
    }

    /**
     * Records the winner of a locked match, eliminates the loser and completes the tournament when
     * this was the final. Must run inside the caller's transaction.
     */
    public void completeMatch(TournamentMatch match, Long winnerId, Long battleRecordId, OffsetDateTime now) {
        if (!match.involves(winnerId)) {
            throw GameStateException.invariantViolation(
                    "WINNER_NOT_IN_MATCH",
                    "Player " + winnerId + " did not play match " + match.getId()
            );
        }
        Long loserId = winnerId.equals(match.getParticipantAId())
                ? match.getParticipantBId()
                : match.getParticipantAId();

        match.setStatus(TournamentMatchStatus.COMPLETED);
        match.setWinnerId(winnerId);
        match.setBattleRecordId(battleRecordId);
        match.setCompletedAt(now);
        match.setUpdatedAt(now);
        tournamentMatchRepository.save(match);

        TournamentParticipant loser = tournamentParticipantRepository
                .findByTournamentIdAndPlayerId(match.getTournamentId(), loserId)
                .orElseThrow(() -> GameStateException.invariantViolation(
                        "PARTICIPANT_MISSING",
                        "Player " + loserId + " is not registered for tournament " + match.getTournamentId()
                ));
        loser.setEliminated(true);
        loser.setEliminatedInRound(match.getRound());
        tournamentParticipantRepository.save(loser);

        log.info(
                "Match {} (tournament {}, round {}) won by player {}; player {} eliminated",
                match.getId(),
                match.getTournamentId(),
                match.getRound(),
                winnerId,
                loserId
        );

        completeTournamentIfResolved(match.getTournamentId(), now);
    }

    @Transactional(readOnly = true)
    public TournamentBracket getBracket(Long tournamentId) {
        Tournament tournament = tournamentRepository.findById(tournamentId)
                .orElseThrow(() -> tournamentNotFound(tournamentId));
        return readBracket(tournament);
    }

    @Transactional(readOnly = true)
    public List<Tournament> listTournaments() {
        return tournamentRepository.findAllByOrderByCreatedAtDescIdDesc();
    }

    private void startBracket(Tournament tournament, OffsetDateTime now) {
        List<TournamentParticipant> participants =
                tournamentParticipantRepository.findByTournamentIdOrderByRegisteredAtAscIdAsc(tournament.getId());
        int minParticipants = arenaProperties.getTournament().getMinParticipants();
        if (participants.size() < Math.max(2, minParticipants)) {
            throw GameStateException.tournamentConflict(
                    "NOT_ENOUGH_PARTICIPANTS",
                    "Tournament " + tournament.getId() + " has " + participants.size()
                            + " participants; at least " + Math.max(2, minParticipants) + " are required"
            );
        }

        Map<Long, Double> ratingsByPlayer = resolveRatings(tournament.getCategory(), participants);
        List<TournamentBracketPlanner.SeededEntrant> seeded = tournamentBracketPlanner.seed(
                participants,
                ratingsByPlayer,
                arenaProperties.getRating().getInitialRating()
        );
        Map<Long, TournamentParticipant> participantsByPlayer = participants.stream()
                .collect(Collectors.toMap(TournamentParticipant::getPlayerId, Function.identity()));
        for (TournamentBracketPlanner.SeededEntrant entrant : seeded) {
            TournamentParticipant participant = participantsByPlayer.get(entrant.playerId());
            participant.setSeed(entrant.seed());
            participant.setSeedRating(entrant.seedRating());
        }
        tournamentParticipantRepository.saveAll(participants);

        persistRound(tournament, 1, tournamentBracketPlanner.planFirstRound(seeded), now);
        tournament.setStatus(TournamentStatus.IN_PROGRESS);
        tournament.setCurrentRound(1);
        tournament.setStartedAt(now);
        tournament.setUpdatedAt(now);
        tournamentRepository.save(tournament);
        log.info("Tournament {} started with {} participants", tournament.getId(), participants.size());
    }

    private void openNextRound(Tournament tournament, OffsetDateTime now) {
        int currentRound = tournament.getCurrentRound();
        List<TournamentMatch> roundMatches =
                tournamentMatchRepository.findByTournamentIdAndRoundOrderByBracketPositionAsc(tournament.getId(), currentRound);
        long unfinished = roundMatches.stream()
                .filter(match -> match.getStatus() != TournamentMatchStatus.COMPLETED)
                .count();
        if (unfinished > 0) {
            throw GameStateException.tournamentConflict(
                    "ROUND_NOT_COMPLETE",
                    unfinished + " match(es) of round " + currentRound + " in tournament "
                            + tournament.getId() + " are not completed"
            );
        }

        List<Long> winners = new ArrayList<>(roundMatches.size());
        for (TournamentMatch match : roundMatches) {
            winners.add(match.getWinnerId());
        }
        requireNoneEliminated(tournament.getId(), winners);

        persistRound(tournament, currentRound + 1, tournamentBracketPlanner.planNextRound(winners), now);
        tournament.setCurrentRound(currentRound + 1);
        tournament.setUpdatedAt(now);
        tournamentRepository.save(tournament);
        log.info(
                "Tournament {} advanced to round {} with {} players",
                tournament.getId(),
                currentRound + 1,
                winners.size()
        );
    }

    private void persistRound(
            Tournament tournament,
            int round,
            List<TournamentBracketPlanner.PlannedMatch> plannedMatches,
            OffsetDateTime now
    ) {
        List<TournamentMatch> matches = new ArrayList<>(plannedMatches.size());
        for (TournamentBracketPlanner.PlannedMatch planned : plannedMatches) {
            TournamentMatch match = new TournamentMatch();
            match.setTournamentId(tournament.getId());
            match.setRound(round);
            match.setBracketPosition(planned.bracketPosition());
            match.setParticipantAId(planned.participantAId());
            match.setParticipantBId(planned.participantBId());
            match.setBye(planned.isBye());
            match.setCreatedAt(now);
            match.setUpdatedAt(now);
            if (planned.isBye()) {
                // Byes never get a battle record.
                match.setStatus(TournamentMatchStatus.COMPLETED);
                match.setWinnerId(planned.participantAId());
                match.setCompletedAt(now);
            }
            matches.add(match);
        }
        tournamentMatchRepository.saveAll(matches);
    }

    private void completeTournamentIfResolved(Long tournamentId, OffsetDateTime now) {
        Tournament tournament = lockTournament(tournamentId);
        if (tournament.getStatus() != TournamentStatus.IN_PROGRESS) {
            return;
        }
        List<TournamentMatch> roundMatches = tournamentMatchRepository
                .findByTournamentIdAndRoundOrderByBracketPositionAsc(tournamentId, tournament.getCurrentRound());
        if (roundMatches.size() != 1) {
            return;
        }
        TournamentMatch finalMatch = roundMatches.get(0);
        if (finalMatch.getStatus() != TournamentMatchStatus.COMPLETED || finalMatch.getWinnerId() == null) {
            return;
        }

        tournament.setStatus(TournamentStatus.COMPLETED);
        tournament.setWinnerId(finalMatch.getWinnerId());
        tournament.setCompletedAt(now);
        tournament.setUpdatedAt(now);
        tournamentRepository.save(tournament);
        log.info("Tournament {} completed; winner is player {}", tournamentId, finalMatch.getWinnerId());
    }

    private Map<Long, Double> resolveRatings(BattleCategory category, List<TournamentParticipant> participants) {
        List<Long> playerIds = participants.stream()
                .map(TournamentParticipant::getPlayerId)
                .toList();
        Map<Long, Double> ratingsByPlayer = new HashMap<>();
        for (BattleRating rating : battleRatingRepository.findByCategoryAndPlayerIdIn(category, playerIds)) {
            ratingsByPlayer.put(rating.getPlayerId(), rating.getRating());
        }
        return ratingsByPlayer;
    }

    private void requireNoneEliminated(Long tournamentId, List<Long> advancingPlayerIds) {
        Set<Long> eliminated = tournamentParticipantRepository.findByTournamentIdOrderByRegisteredAtAscIdAsc(tournamentId)
                .stream()
                .filter(TournamentParticipant::isEliminated)
                .map(TournamentParticipant::getPlayerId)
                .collect(Collectors.toSet());
        for (Long playerId : advancingPlayerIds) {
            if (playerId == null || eliminated.contains(playerId)) {
                throw GameStateException.invariantViolation(
                        "ELIMINATED_PLAYER_ADVANCING",
                        "Player " + playerId + " cannot advance in tournament " + tournamentId
                );
            }
        }
    }

    private TournamentBracket readBracket(Tournament tournament) {
        return new TournamentBracket(
                tournament,
                tournamentParticipantRepository.findByTournamentIdOrderByRegisteredAtAscIdAsc(tournament.getId()),
                tournamentMatchRepository.findByTournamentIdOrderByRoundAscBracketPositionAsc(tournament.getId())
        );
    }

    private Tournament lockTournament(Long tournamentId) {
        return tournamentRepository.findByIdForUpdate(tournamentId)
                .orElseThrow(() -> tournamentNotFound(tournamentId));
    }

    private static void requireInProgress(Tournament tournament) {
        if (tournament.getStatus() != TournamentStatus.IN_PROGRESS) {
            throw GameStateException.tournamentConflict(
                    "TOURNAMENT_NOT_IN_PROGRESS",
                    "Tournament " + tournament.getId() + " is " + tournament.getStatus()
            );
        }
    }

    private static GameStateException tournamentNotFound(Long tournamentId) {
        return GameStateException.notFound("TOURNAMENT_NOT_FOUND", "Tournament not found: " + tournamentId);
    }

    private static GameStateException matchNotFound(Long matchId) {
        return GameStateException.notFound("MATCH_NOT_FOUND", "Tournament match not found: " + matchId);
    }
}
