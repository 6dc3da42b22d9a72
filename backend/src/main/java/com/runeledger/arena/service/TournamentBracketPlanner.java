package com.runeledger.arena.service;

import com.runeledger.arena.model.TournamentParticipant;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Deterministic single-elimination pairing. Round one pairs seed 1 with seed n, seed 2 with
 * seed n-1 and so on, giving the top seed the bye when the field is odd. Later rounds feed the
 * winners of matches 2k-1 and 2k into slots A and B of match k; an odd field leaves the last
 * position as a bye.
 */
@Component
public class TournamentBracketPlanner {

    public List<SeededEntrant> seed(
            List<TournamentParticipant> participants,
            Map<Long, Double> ratingsByPlayer,
            double defaultRating
    ) {
        if (participants == null || participants.isEmpty()) {
            throw new IllegalArgumentException("Cannot seed an empty field");
        }
        validateUnique(participants);

        Comparator<TournamentParticipant> seedOrder = Comparator
                .comparingDouble((TournamentParticipant participant) ->
                        resolveRating(participant, ratingsByPlayer, defaultRating))
                .reversed()
                .thenComparing(TournamentParticipant::getRegisteredAt, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(TournamentParticipant::getPlayerId);

        List<TournamentParticipant> ordered = new ArrayList<>(participants);
        ordered.sort(seedOrder);

        List<SeededEntrant> seeded = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            TournamentParticipant participant = ordered.get(i);
            seeded.add(new SeededEntrant(
                    participant.getPlayerId(),
                    i + 1,
                    resolveRating(participant, ratingsByPlayer, defaultRating)
            ));
        }
        return List.copyOf(seeded);
    }

    public List<PlannedMatch> planFirstRound(List<SeededEntrant> seeded) {
        if (seeded == null || seeded.size() < 2) {
            throw new IllegalArgumentException("A bracket needs at least two entrants");
        }

        int fieldSize = seeded.size();
        List<PlannedMatch> matches = new ArrayList<>();
        int first = 0;
        if (fieldSize % 2 == 1) {
            matches.add(PlannedMatch.bye(1, seeded.get(0).playerId()));
            first = 1;
        }
        int last = fieldSize - 1;
        while (first < last) {
            matches.add(new PlannedMatch(
                    matches.size() + 1,
                    seeded.get(first).playerId(),
                    seeded.get(last).playerId()
            ));
            first++;
            last--;
        }
        return List.copyOf(matches);
    }

    /**
     * @param winnersInBracketOrder winners of the previous round ordered by bracket position
     */
    public List<PlannedMatch> planNextRound(List<Long> winnersInBracketOrder) {
        if (winnersInBracketOrder == null || winnersInBracketOrder.size() < 2) {
            throw new IllegalArgumentException("A round needs at least two entrants");
        }
        if (new HashSet<>(winnersInBracketOrder).size() != winnersInBracketOrder.size()) {
            throw new IllegalArgumentException("A player cannot advance twice into the same round");
        }

        List<PlannedMatch> matches = new ArrayList<>();
        for (int i = 0; i + 1 < winnersInBracketOrder.size(); i += 2) {
            matches.add(new PlannedMatch(
                    matches.size() + 1,
                    winnersInBracketOrder.get(i),
                    winnersInBracketOrder.get(i + 1)
            ));
        }
        if (winnersInBracketOrder.size() % 2 == 1) {
            matches.add(PlannedMatch.bye(
                    matches.size() + 1,
                    winnersInBracketOrder.get(winnersInBracketOrder.size() - 1)
            ));
        }
        return List.copyOf(matches);
    }

    private static double resolveRating(
            TournamentParticipant participant,
            Map<Long, Double> ratingsByPlayer,
            double defaultRating
    ) {
        Double rating = ratingsByPlayer.get(participant.getPlayerId());
        return rating != null ? rating : defaultRating;
    }

    private static void validateUnique(List<TournamentParticipant> participants) {
        Set<Long> playerIds = new HashSet<>();
        for (TournamentParticipant participant : participants) {
            if (participant.getPlayerId() == null) {
                throw new IllegalArgumentException("Tournament participant is missing playerId: " + participant.getId());
            }
            if (!playerIds.add(participant.getPlayerId())) {
                throw new IllegalArgumentException("Duplicate player in tournament field: " + participant.getPlayerId());
            }
        }
    }

    public record SeededEntrant(
            Long playerId,
            int seed,
            double seedRating
    ) {
    }

    public record PlannedMatch(
            int bracketPosition,
            Long participantAId,
            Long participantBId
    ) {
        static PlannedMatch bye(int bracketPosition, Long playerId) {
            return new PlannedMatch(bracketPosition, playerId, null);
        }

        public boolean isBye() {
            return participantBId == null;
        }
    }
}
