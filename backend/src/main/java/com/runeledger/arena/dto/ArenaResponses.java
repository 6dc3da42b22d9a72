package com.runeledger.arena.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.runeledger.arena.model.BattleOutcome;
import com.runeledger.arena.model.TournamentMatchStatus;
import com.runeledger.arena.model.TournamentStatus;
import com.runeledger.model.BattleCategory;

import java.time.OffsetDateTime;
import java.util.List;

public final class ArenaResponses {

    private ArenaResponses() {
    }

    public record Battle(
            Long battleId,
            String battleKey,
            BattleCategory category,
            Long participantAId,
            Long participantBId,
            BattleOutcome outcome,
            Long winnerId,
            Integer turns,
            Integer durationSeconds,
            Long tournamentMatchId,
            JsonNode outcomePayload,
            OffsetDateTime startedAt,
            OffsetDateTime recordedAt
    ) {
    }

    public record Rating(
            Long playerId,
            BattleCategory category,
            Double rating,
            Double uncertainty,
            Integer wins,
            Integer losses,
            Integer draws,
            Integer totalBattles,
            Integer winStreak,
            Integer lossStreak,
            Integer highestWinStreak,
            Long totalDamageDealt,
            Long totalDamageTaken,
            OffsetDateTime lastBattleAt
    ) {
    }

    public record RatingChange(
            Double previousRating,
            Double newRating,
            Double delta,
            Double kFactor,
            Double previousUncertainty,
            Double newUncertainty
    ) {
    }

    public record BattleResult(
            Battle battle,
            boolean replayed,
            Rating ratingA,
            Rating ratingB,
            RatingChange changeA,
            RatingChange changeB
    ) {
    }

    public record DecayRun(
            Integer ratingsScanned,
            Integer ratingsUpdated
    ) {
    }

    public record TournamentSummary(
            Long tournamentId,
            String name,
            BattleCategory category,
            TournamentStatus status,
            Integer maxParticipants,
            Integer currentRound,
            Long winnerId,
            OffsetDateTime createdAt,
            OffsetDateTime startedAt,
            OffsetDateTime completedAt
    ) {
    }

    public record Participant(
            Long participantId,
            Long playerId,
            Integer seed,
            Double seedRating,
            boolean eliminated,
            Integer eliminatedInRound,
            OffsetDateTime registeredAt
    ) {
    }

    public record Match(
            Long matchId,
            Integer round,
            Integer bracketPosition,
            Long participantAId,
            Long participantBId,
            boolean bye,
            TournamentMatchStatus status,
            Long winnerId,
            Long battleRecordId,
            OffsetDateTime scheduledAt,
            OffsetDateTime completedAt
    ) {
    }

    public record Bracket(
            TournamentSummary tournament,
            List<Participant> participants,
            List<Match> matches
    ) {
    }
}
