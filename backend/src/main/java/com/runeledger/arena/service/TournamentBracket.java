package com.runeledger.arena.service;

import com.runeledger.arena.model.Tournament;
import com.runeledger.arena.model.TournamentMatch;
import com.runeledger.arena.model.TournamentParticipant;

import java.util.List;

public record TournamentBracket(
        Tournament tournament,
        List<TournamentParticipant> participants,
        List<TournamentMatch> matches
) {
}
