package com.runeledger.controller;

import com.runeledger.dto.ProgressionRequests;
import com.runeledger.dto.ProgressionResponses;
import com.runeledger.mapper.GameStateResponseMapper;
import com.runeledger.service.AchievementLedgerService;
import com.runeledger.service.CollectionLogService;
import com.runeledger.service.QuestService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
public class ProgressionController {

    private final CollectionLogService collectionLogService;
    private final QuestService questService;
    private final AchievementLedgerService achievementLedgerService;
    private final GameStateResponseMapper responseMapper;

    public ProgressionController(
            CollectionLogService collectionLogService,
            QuestService questService,
            AchievementLedgerService achievementLedgerService,
            GameStateResponseMapper responseMapper
    ) {
        this.collectionLogService = collectionLogService;
        this.questService = questService;
        this.achievementLedgerService = achievementLedgerService;
        this.responseMapper = responseMapper;
    }

    @PostMapping("/players/{playerId}/collection-log")
    public ResponseEntity<ProgressionResponses.ObtainedOutcome> recordObtained(
            @PathVariable Long playerId,
            @Valid @RequestBody ProgressionRequests.RecordObtainedRequest request
    ) {
        return ResponseEntity.ok(responseMapper.toObtainedOutcomeResponse(
                collectionLogService.recordObtained(playerId, request.itemId(), request.quantity(), request.dropKey())
        ));
    }

    @GetMapping("/players/{playerId}/collection-log")
    public ResponseEntity<List<ProgressionResponses.CollectionEntry>> listCollectionLog(@PathVariable Long playerId) {
        return ResponseEntity.ok(collectionLogService.listEntries(playerId).stream()
                .map(responseMapper::toCollectionEntryResponse)
                .toList());
    }

    @GetMapping("/quests")
    public ResponseEntity<List<ProgressionResponses.Quest>> listQuests() {
        return ResponseEntity.ok(questService.listQuests().stream().map(responseMapper::toQuestResponse).toList());
    }

    @PostMapping("/players/{playerId}/quests")
    public ResponseEntity<ProgressionResponses.QuestCompletion> completeQuest(
            @PathVariable Long playerId,
            @Valid @RequestBody ProgressionRequests.CompleteQuestRequest request
    ) {
        return ResponseEntity.ok(responseMapper.toQuestCompletionResponse(
                questService.completeQuest(playerId, request.questId())
        ));
    }

    @GetMapping("/players/{playerId}/quests")
    public ResponseEntity<List<ProgressionResponses.CompletedQuest>> listCompletedQuests(@PathVariable Long playerId) {
        return ResponseEntity.ok(questService.listCompleted(playerId).stream()
                .map(responseMapper::toCompletedQuestResponse)
                .toList());
    }

    @GetMapping("/achievements")
    public ResponseEntity<List<ProgressionResponses.Achievement>> listAchievements() {
        return ResponseEntity.ok(achievementLedgerService.listDefinitions().stream()
                .map(responseMapper::toAchievementResponse)
                .toList());
    }

    @GetMapping("/players/{playerId}/achievements")
    public ResponseEntity<List<ProgressionResponses.EarnedAchievement>> listPlayerAchievements(@PathVariable Long playerId) {
        return ResponseEntity.ok(achievementLedgerService.listPlayerAchievements(playerId).stream()
                .map(responseMapper::toEarnedAchievementResponse)
                .toList());
    }
}
