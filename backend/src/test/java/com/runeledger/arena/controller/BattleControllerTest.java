package com.runeledger.arena.controller;

import com.runeledger.arena.mapper.ArenaResponseMapper;
import com.runeledger.arena.model.BattleOutcome;
import com.runeledger.arena.model.BattleRating;
import com.runeledger.arena.model.BattleRecord;
import com.runeledger.arena.service.BattleRatingService;
import com.runeledger.arena.service.BattleResult;
import com.runeledger.arena.service.GlickoRatingCalculator;
import com.runeledger.arena.service.RatingMaintenanceService;
import com.runeledger.arena.service.RecordBattleCommand;
import com.runeledger.model.BattleCategory;
import com.runeledger.web.GameStateException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.OffsetDateTime;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(BattleController.class)
@Import(ArenaResponseMapper.class)
class BattleControllerTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2026-07-04T20:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private BattleRatingService battleRatingService;

    @MockitoBean
    private RatingMaintenanceService ratingMaintenanceService;

    @Test
    void recordBattleReturnsCreatedWithRatingChanges() throws Exception {
        when(battleRatingService.recordBattle(any(RecordBattleCommand.class)))
                .thenReturn(new BattleResult(
                        sampleRecord(),
                        false,
                        sampleRating(5L, 1016.0),
                        sampleRating(3L, 984.0),
                        new GlickoRatingCalculator.RatingChange(1000.0, 1016.0, 16.0, 32.0, 350.0, 332.5),
                        new GlickoRatingCalculator.RatingChange(1000.0, 984.0, -16.0, 32.0, 350.0, 332.5)
                ));

        mockMvc.perform(post("/api/arena/battles")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "battleKey": "duel-1",
                                  "category": "OSRS",
                                  "participantAId": 5,
                                  "participantBId": 3,
                                  "outcome": "PARTICIPANT_A_WON",
                                  "outcomePayload": {
                                    "turns": 14,
                                    "participant_a": {"damage_dealt": 87, "damage_taken": 40}
                                  }
                                }
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.replayed").value(false))
                .andExpect(jsonPath("$.battle.winnerId").value(5))
                .andExpect(jsonPath("$.ratingA.rating").value(1016.0))
                .andExpect(jsonPath("$.changeB.delta").value(-16.0));
    }

    @Test
    void recordBattleReplayReturnsOk() throws Exception {
        when(battleRatingService.recordBattle(any(RecordBattleCommand.class)))
                .thenReturn(new BattleResult(sampleRecord(), true, sampleRating(5L, 1016.0), sampleRating(3L, 984.0), null, null));

        mockMvc.perform(post("/api/arena/battles")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "battleKey": "duel-1",
                                  "category": "OSRS",
                                  "participantAId": 5,
                                  "participantBId": 3,
                                  "outcome": "PARTICIPANT_A_WON"
                                }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.replayed").value(true))
                .andExpect(jsonPath("$.battle.battleId").value(900));
    }

    @Test
    void recordBattleAgainstSelfReturnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/arena/battles")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "battleKey": "duel-2",
                                  "category": "OSRS",
                                  "participantAId": 5,
                                  "participantBId": 5,
                                  "outcome": "DRAW"
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));

        verify(battleRatingService, never()).recordBattle(any());
    }

    @Test
    void recordBattleReusedKeyReturnsConflict() throws Exception {
        when(battleRatingService.recordBattle(any(RecordBattleCommand.class)))
                .thenThrow(GameStateException.battleKeyConflict("Battle key duel-1 was already used for a different battle"));

        mockMvc.perform(post("/api/arena/battles")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "battleKey": "duel-1",
                                  "category": "OSRS",
                                  "participantAId": 5,
                                  "participantBId": 3,
                                  "outcome": "PARTICIPANT_B_WON"
                                }
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("BATTLE_KEY_CONFLICT"));
    }

    @Test
    void leaderboardPassesCategoryAndLimit() throws Exception {
        when(battleRatingService.leaderboard(BattleCategory.POKEMON, 2))
                .thenReturn(List.of(sampleRating(8L, 1400.0), sampleRating(9L, 1250.0)));

        mockMvc.perform(get("/api/arena/leaderboards/{category}", "POKEMON").param("limit", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].playerId").value(8))
                .andExpect(jsonPath("$[1].rating").value(1250.0));
    }

    @Test
    void runDecayPassReturnsCounts() throws Exception {
        when(ratingMaintenanceService.applyInactivityDecay(any(OffsetDateTime.class)))
                .thenReturn(new RatingMaintenanceService.DecaySummary(12, 4));

        mockMvc.perform(post("/api/arena/maintenance/decay"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ratingsScanned").value(12))
                .andExpect(jsonPath("$.ratingsUpdated").value(4));

        verify(ratingMaintenanceService).applyInactivityDecay(any(OffsetDateTime.class));
    }

    @Test
    void getBattleMissingReturnsNotFound() throws Exception {
        when(battleRatingService.getBattle(eq(77L)))
                .thenThrow(GameStateException.notFound("BATTLE_NOT_FOUND", "Battle not found: 77"));

        mockMvc.perform(get("/api/arena/battles/{battleId}", 77L))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("BATTLE_NOT_FOUND"));
    }

    private static BattleRecord sampleRecord() {
        BattleRecord record = new BattleRecord();
        record.setId(900L);
        record.setBattleKey("duel-1");
        record.setCategory(BattleCategory.OSRS);
        record.setParticipantAId(5L);
        record.setParticipantBId(3L);
        record.setOutcome(BattleOutcome.PARTICIPANT_A_WON);
        record.setWinnerId(5L);
        record.setRecordedAt(NOW);
        return record;
    }

    private static BattleRating sampleRating(Long playerId, double rating) {
        BattleRating battleRating = new BattleRating();
        battleRating.setPlayerId(playerId);
        battleRating.setCategory(BattleCategory.OSRS);
        battleRating.setRating(rating);
        return battleRating;
    }
}
