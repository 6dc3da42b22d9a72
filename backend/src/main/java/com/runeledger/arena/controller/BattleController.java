package com.runeledger.arena.controller;

import com.runeledger.arena.dto.ArenaRequests;
import com.runeledger.arena.dto.ArenaResponses;
import com.runeledger.arena.mapper.ArenaResponseMapper;
import com.runeledger.arena.service.BattleRatingService;
import com.runeledger.arena.service.BattleResult;
import com.runeledger.arena.service.RatingMaintenanceService;
import com.runeledger.arena.service.RecordBattleCommand;
import com.runeledger.model.BattleCategory;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.OffsetDateTime;
import java.util.List;

@RestController
@RequestMapping("/api/arena")
public class BattleController {

    private final BattleRatingService battleRatingService;
    private final RatingMaintenanceService ratingMaintenanceService;
    private final ArenaResponseMapper arenaResponseMapper;

    public BattleController(
            BattleRatingService battleRatingService,
            RatingMaintenanceService ratingMaintenanceService,
            ArenaResponseMapper arenaResponseMapper
    ) {
        this.battleRatingService = battleRatingService;
        this.ratingMaintenanceService = ratingMaintenanceService;
        this.arenaResponseMapper = arenaResponseMapper;
    }

    /**
     * Replaying a battle key answers 200 with the stored record; a new battle answers 201.
     */
    @PostMapping("/battles")
    public ResponseEntity<ArenaResponses.BattleResult> recordBattle(
            @Valid @RequestBody ArenaRequests.RecordBattleRequest request
    ) {
        BattleResult result = battleRatingService.recordBattle(new RecordBattleCommand(
                request.battleKey(),
                request.category(),
                request.participantAId(),
                request.participantBId(),
                request.outcome(),
                request.outcomePayload(),
                request.tournamentMatchId(),
                request.startedAt()
        ));
        HttpStatus status = result.replayed() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(arenaResponseMapper.toBattleResultResponse(result));
    }

    @GetMapping("/battles/{battleId}")
    public ResponseEntity<ArenaResponses.Battle> getBattle(@PathVariable Long battleId) {
        return ResponseEntity.ok(arenaResponseMapper.toBattleResponse(battleRatingService.getBattle(battleId)));
    }

    @GetMapping("/players/{playerId}/battles")
    public ResponseEntity<List<ArenaResponses.Battle>> listRecentBattles(@PathVariable Long playerId) {
        return ResponseEntity.ok(arenaResponseMapper.toBattleResponses(battleRatingService.listRecentBattles(playerId)));
    }

    @GetMapping("/players/{playerId}/ratings")
    public ResponseEntity<List<ArenaResponses.Rating>> listRatings(@PathVariable Long playerId) {
        return ResponseEntity.ok(arenaResponseMapper.toRatingResponses(battleRatingService.listRatings(playerId)));
    }

    @GetMapping("/leaderboards/{category}")
    public ResponseEntity<List<ArenaResponses.Rating>> leaderboard(
            @PathVariable BattleCategory category,
            @RequestParam(defaultValue = "25") int limit
    ) {
        return ResponseEntity.ok(arenaResponseMapper.toRatingResponses(battleRatingService.leaderboard(category, limit)));
    }

    @PostMapping("/maintenance/decay")
    public ResponseEntity<ArenaResponses.DecayRun> runDecayPass() {
        RatingMaintenanceService.DecaySummary summary = ratingMaintenanceService.applyInactivityDecay(OffsetDateTime.now());
        return ResponseEntity.ok(arenaResponseMapper.toDecayRunResponse(summary));
    }
}
