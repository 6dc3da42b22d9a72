package com.runeledger.arena.mapper;

import com.runeledger.arena.dto.ArenaResponses;
import com.runeledger.arena.model.BattleRating;
import com.runeledger.arena.model.BattleRecord;
import com.runeledger.arena.model.Tournament;
import com.runeledger.arena.model.TournamentMatch;
import com.runeledger.arena.model.TournamentParticipant;
import com.runeledger.arena.service.BattleResult;
import com.runeledger.arena.service.GlickoRatingCalculator;
import com.runeledger.arena.service.RatingMaintenanceService;
import com.runeledger.arena.service.TournamentBracket;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;

@Component
public class ArenaResponseMapper {

    public ArenaResponses.Battle toBattleResponse(BattleRecord record) {
        return new ArenaResponses.Battle(
                record.getId(),
                record.getBattleKey(),
                record.getCategory(),
                record.getParticipantAId(),
                record.getParticipantBId(),
                record.getOutcome(),
                record.getWinnerId(),
                record.getTurns(),
                record.getDurationSeconds(),
                record.getTournamentMatchId(),
                record.getOutcomePayload(),
                record.getStartedAt(),
                record.getRecordedAt()
        );
    }

    public List<ArenaResponses.Battle> toBattleResponses(Collection<BattleRecord> records) {
        return records.stream().map(this::toBattleResponse).toList();
    }

    public ArenaResponses.Rating toRatingResponse(BattleRating rating) {
        if (rating == null) {
            return null;
        }
        return new ArenaResponses.Rating(
                rating.getPlayerId(),
                rating.getCategory(),
                rating.getRating(),
                rating.getUncertainty(),
                rating.getWins(),
                rating.getLosses(),
                rating.getDraws(),
                rating.getTotalBattles(),
                rating.getWinStreak(),
                rating.getLossStreak(),
                rating.getHighestWinStreak(),
                rating.getTotalDamageDealt(),
                rating.getTotalDamageTaken(),
                rating.getLastBattleAt()
        );
    }

    public List<ArenaResponses.Rating> toRatingResponses(Collection<BattleRating> ratings) {
        return ratings.stream().map(this::toRatingResponse).toList();
    }

    public ArenaResponses.BattleResult toBattleResultResponse(BattleResult result) {
        return new ArenaResponses.BattleResult(
                toBattleResponse(result.record()),
                result.replayed(),
                toRatingResponse(result.ratingA()),
                toRatingResponse(result.ratingB()),
                toRatingChangeResponse(result.changeA()),
                toRatingChangeResponse(result.changeB())
        );
    }

    public ArenaResponses.DecayRun toDecayRunResponse(RatingMaintenanceService.DecaySummary summary) {
        return new ArenaResponses.DecayRun(summary.ratingsScanned(), summary.ratingsUpdated());
    }

    public ArenaResponses.TournamentSummary toTournamentSummaryResponse(Tournament tournament) {
        return new ArenaResponses.TournamentSummary(
                tournament.getId(),
                tournament.getName(),
                tournament.getCategory(),
                tournament.getStatus(),
                tournament.getMaxParticipants(),
                tournament.getCurrentRound(),
                tournament.getWinnerId(),
                tournament.getCreatedAt(),
                tournament.getStartedAt(),
                tournament.getCompletedAt()
        );
    }

    public List<ArenaResponses.TournamentSummary> toTournamentSummaryResponses(Collection<Tournament> tournaments) {
        return tournaments.stream().map(this::toTournamentSummaryResponse).toList();
    }

    public ArenaResponses.Participant toParticipantResponse(TournamentParticipant participant) {
        return new ArenaResponses.Participant(
                participant.getId(),
                participant.getPlayerId(),
                participant.getSeed(),
                participant.getSeedRating(),
                participant.isEliminated(),
                participant.getEliminatedInRound(),
                participant.getRegisteredAt()
        );
    }

    public ArenaResponses.Match toMatchResponse(TournamentMatch match) {
        return new ArenaResponses.Match(
                match.getId(),
                match.getRound(),
                match.getBracketPosition(),
                match.getParticipantAId(),
                match.getParticipantBId(),
                match.isBye(),
                match.getStatus(),
                match.getWinnerId(),
                match.getBattleRecordId(),
                match.getScheduledAt(),
                match.getCompletedAt()
        );
    }

    public ArenaResponses.Bracket toBracketResponse(TournamentBracket bracket) {
        return new ArenaResponses.Bracket(
                toTournamentSummaryResponse(bracket.tournament()),
                bracket.participants().stream().map(this::toParticipantResponse).toList(),
                bracket.matches().stream().map(this::toMatchResponse).toList()
        );
    }

    private ArenaResponses.RatingChange toRatingChangeResponse(GlickoRatingCalculator.RatingChange change) {
        if (change == null) {
            return null;
        }
        return new ArenaResponses.RatingChange(
                change.previousRating(),
                change.newRating(),
                change.delta(),
                change.kFactor(),
                change.previousUncertainty(),
                change.newUncertainty()
        );
    }
}
