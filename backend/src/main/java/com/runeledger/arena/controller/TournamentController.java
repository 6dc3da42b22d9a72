package com.runeledger.arena.controller;

import com.runeledger.arena.dto.ArenaRequests;
import com.runeledger.arena.dto.ArenaResponses;
import com.runeledger.arena.mapper.ArenaResponseMapper;
import com.runeledger.arena.model.Tournament;
import com.runeledger.arena.model.TournamentMatch;
import com.runeledger.arena.model.TournamentParticipant;
import com.runeledger.arena.service.TournamentService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/arena/tournaments")
public class TournamentController {

    private final TournamentService tournamentService;
    private final ArenaResponseMapper arenaResponseMapper;

    public TournamentController(TournamentService tournamentService, ArenaResponseMapper arenaResponseMapper) {
        this.tournamentService = tournamentService;
        this.arenaResponseMapper = arenaResponseMapper;
    }

    @PostMapping
    public ResponseEntity<ArenaResponses.TournamentSummary> createTournament(
            @Valid @RequestBody ArenaRequests.CreateTournamentRequest request
    ) {
        Tournament tournament = tournamentService.createTournament(
                request.name(),
                request.category(),
                request.maxParticipants()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(arenaResponseMapper.toTournamentSummaryResponse(tournament));
    }

    @GetMapping
    public ResponseEntity<List<ArenaResponses.TournamentSummary>> listTournaments() {
        return ResponseEntity.ok(arenaResponseMapper.toTournamentSummaryResponses(tournamentService.listTournaments()));
    }

    @GetMapping("/{tournamentId}")
    public ResponseEntity<ArenaResponses.Bracket> getBracket(@PathVariable Long tournamentId) {
        return ResponseEntity.ok(arenaResponseMapper.toBracketResponse(tournamentService.getBracket(tournamentId)));
    }

    @PostMapping("/{tournamentId}/participants")
    public ResponseEntity<ArenaResponses.Participant> registerParticipant(
            @PathVariable Long tournamentId,
            @Valid @RequestBody ArenaRequests.RegisterParticipantRequest request
    ) {
        TournamentParticipant participant = tournamentService.registerParticipant(tournamentId, request.playerId());
        return ResponseEntity.status(HttpStatus.CREATED).body(arenaResponseMapper.toParticipantResponse(participant));
    }

    @PostMapping("/{tournamentId}/advance")
    public ResponseEntity<ArenaResponses.Bracket> advanceRound(@PathVariable Long tournamentId) {
        return ResponseEntity.ok(arenaResponseMapper.toBracketResponse(tournamentService.advanceTournamentRound(tournamentId)));
    }

    @PostMapping("/matches/{matchId}/schedule")
    public ResponseEntity<ArenaResponses.Match> scheduleMatch(
            @PathVariable Long matchId,
            @RequestBody(required = false) ArenaRequests.ScheduleMatchRequest request
    ) {
        TournamentMatch match = tournamentService.scheduleMatch(matchId, request != null ? request.scheduledAt() : null);
        return ResponseEntity.ok(arenaResponseMapper.toMatchResponse(match));
    }
}
