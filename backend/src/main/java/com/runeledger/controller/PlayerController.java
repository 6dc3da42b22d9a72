package com.runeledger.controller;

import com.runeledger.dto.PlayerRequests;
import com.runeledger.dto.PlayerResponses;
import com.runeledger.mapper.GameStateResponseMapper;
import com.runeledger.model.Player;
import com.runeledger.model.SkillType;
import com.runeledger.service.PlayerPurgeService;
import com.runeledger.service.PlayerService;
import com.runeledger.service.SkillProgressionService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for player records and skill progression.
 */
@RestController
@RequestMapping("/api/players")
public class PlayerController {

    private final PlayerService playerService;
    private final SkillProgressionService skillProgressionService;
    private final PlayerPurgeService playerPurgeService;
    private final GameStateResponseMapper responseMapper;

    public PlayerController(
            PlayerService playerService,
            SkillProgressionService skillProgressionService,
            PlayerPurgeService playerPurgeService,
            GameStateResponseMapper responseMapper
    ) {
        this.playerService = playerService;
        this.skillProgressionService = skillProgressionService;
        this.playerPurgeService = playerPurgeService;
        this.responseMapper = responseMapper;
    }

    /**
     * Idempotent on accountId: a repeated registration returns the existing player.
     */
    @PostMapping
    public ResponseEntity<PlayerResponses.Player> registerPlayer(
            @Valid @RequestBody PlayerRequests.RegisterPlayerRequest request
    ) {
        Player player = playerService.registerPlayer(
                request.accountId(),
                request.displayName(),
                request.world(),
                request.member(),
                request.gameMode()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(responseMapper.toPlayerResponse(player));
    }

    @GetMapping("/{playerId}")
    public ResponseEntity<PlayerResponses.Player> getPlayer(@PathVariable Long playerId) {
        return ResponseEntity.ok(responseMapper.toPlayerResponse(playerService.getPlayer(playerId)));
    }

    @GetMapping("/by-account/{accountId}")
    public ResponseEntity<PlayerResponses.Player> getPlayerByAccount(@PathVariable Long accountId) {
        return ResponseEntity.ok(responseMapper.toPlayerResponse(playerService.getPlayerByAccountId(accountId)));
    }

    @GetMapping("/{playerId}/snapshot")
    public ResponseEntity<PlayerResponses.Snapshot> getSnapshot(@PathVariable Long playerId) {
        return ResponseEntity.ok(responseMapper.toSnapshotResponse(playerService.getSnapshot(playerId)));
    }

    @PutMapping("/{playerId}/status")
    public ResponseEntity<PlayerResponses.Player> updateStatus(
            @PathVariable Long playerId,
            @Valid @RequestBody PlayerRequests.UpdateStatusRequest request
    ) {
        return ResponseEntity.ok(responseMapper.toPlayerResponse(playerService.updateStatus(playerId, request.status())));
    }

    @PutMapping("/{playerId}/skills/{skill}/experience")
    public ResponseEntity<PlayerResponses.SkillUpdate> updateSkillExperience(
            @PathVariable Long playerId,
            @PathVariable SkillType skill,
            @Valid @RequestBody PlayerRequests.SetExperienceRequest request
    ) {
        return ResponseEntity.ok(responseMapper.toSkillUpdateResponse(
                skillProgressionService.updateSkillExperience(playerId, skill, request.experience())
        ));
    }

    @PostMapping("/{playerId}/skills/{skill}/experience")
    public ResponseEntity<PlayerResponses.SkillUpdate> addSkillExperience(
            @PathVariable Long playerId,
            @PathVariable SkillType skill,
            @Valid @RequestBody PlayerRequests.AddExperienceRequest request
    ) {
        return ResponseEntity.ok(responseMapper.toSkillUpdateResponse(
                skillProgressionService.addSkillExperience(playerId, skill, request.delta())
        ));
    }

    @PostMapping("/{playerId}/skills/{skill}/reset")
    public ResponseEntity<PlayerResponses.SkillUpdate> resetSkill(
            @PathVariable Long playerId,
            @PathVariable SkillType skill,
            @Valid @RequestBody PlayerRequests.SetExperienceRequest request
    ) {
        return ResponseEntity.ok(responseMapper.toSkillUpdateResponse(
                skillProgressionService.resetSkill(playerId, skill, request.experience())
        ));
    }

    /**
     * Hard delete of the player and every row it owns. Trades, battles and brackets are kept.
     */
    @DeleteMapping("/{playerId}")
    public ResponseEntity<PlayerResponses.PurgeReport> purgePlayer(@PathVariable Long playerId) {
        return ResponseEntity.ok(responseMapper.toPurgeReportResponse(playerPurgeService.purgePlayer(playerId)));
    }
}
