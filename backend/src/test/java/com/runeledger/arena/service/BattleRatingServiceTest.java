package com.runeledger.arena.service;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.runeledger.arena.config.ArenaProperties;
import com.runeledger.arena.model.BattleOutcome;
import com.runeledger.arena.model.BattleRating;
import com.runeledger.arena.model.BattleRecord;
import com.runeledger.arena.model.TournamentMatch;
import com.runeledger.arena.repository.BattleRatingRepository;
import com.runeledger.arena.repository.BattleRecordRepository;
import com.runeledger.model.BattleCategory;
import com.runeledger.model.Player;
import com.runeledger.model.PlayerStatus;
import com.runeledger.repository.PlayerRepository;
import com.runeledger.service.TransactionRetryExecutor;
import com.runeledger.web.GameStateException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentMatchers;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Optional;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BattleRatingServiceTest {

    private static final Long PLAYER_A = 5L;
    private static final Long PLAYER_B = 3L;

    @Mock
    private BattleRecordRepository battleRecordRepository;

    @Mock
    private BattleRatingRepository battleRatingRepository;

    @Mock
    private PlayerRepository playerRepository;

    @Mock
    private TournamentService tournamentService;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @Mock
    private TransactionRetryExecutor transactionRetryExecutor;

    private BattleRatingService battleRatingService;
    private BattleRating ratingA;
    private BattleRating ratingB;

    @BeforeEach
    void setUp() {
        ArenaProperties arenaProperties = new ArenaProperties();
        battleRatingService = new BattleRatingService(
                battleRecordRepository,
                battleRatingRepository,
                playerRepository,
                tournamentService,
                new GlickoRatingCalculator(arenaProperties),
                eventPublisher,
                transactionRetryExecutor,
                arenaProperties
        );
        ratingA = rating(PLAYER_A);
        ratingB = rating(PLAYER_B);

        lenient().when(transactionRetryExecutor.execute(
                anyString(),
                ArgumentMatchers.<Supplier<BattleResult>>any(),
                anyList()
        )).thenAnswer(invocation -> invocation.<Supplier<BattleResult>>getArgument(1).get());
        lenient().when(playerRepository.findById(PLAYER_A)).thenReturn(Optional.of(player(PLAYER_A)));
        lenient().when(playerRepository.findById(PLAYER_B)).thenReturn(Optional.of(player(PLAYER_B)));
        lenient().when(battleRatingRepository.findByPlayerIdAndCategoryForUpdate(PLAYER_A, BattleCategory.OSRS))
                .thenReturn(Optional.of(ratingA));
        lenient().when(battleRatingRepository.findByPlayerIdAndCategoryForUpdate(PLAYER_B, BattleCategory.OSRS))
                .thenReturn(Optional.of(ratingB));
        lenient().when(battleRecordRepository.findByBattleKey(anyString())).thenReturn(Optional.empty());
        lenient().when(battleRecordRepository.saveAndFlush(any(BattleRecord.class))).thenAnswer(invocation -> {
            BattleRecord record = invocation.getArgument(0);
            record.setId(900L);
            return record;
        });
    }

    @Test
    void recordBattle_equalRatings_winnerGainsLoserLoses() {
        BattleResult result = battleRatingService.recordBattle(command("duel-1", BattleOutcome.PARTICIPANT_A_WON, null));

        assertEquals(1016.0, ratingA.getRating(), 1e-9);
        assertEquals(984.0, ratingB.getRating(), 1e-9);
        assertEquals(332.5, ratingA.getUncertainty(), 1e-9);
        assertEquals(1, ratingA.getWins());
        assertEquals(1, ratingA.getWinStreak());
        assertEquals(1, ratingA.getHighestWinStreak());
        assertEquals(1, ratingB.getLosses());
        assertEquals(1, ratingB.getLossStreak());
        assertEquals(PLAYER_A, result.record().getWinnerId());
        assertEquals(16.0, result.changeA().delta(), 1e-9);
        verify(eventPublisher).publishEvent(any(BattleRecordedEvent.class));
    }

    @Test
    void recordBattle_locksRatingRowsInAscendingPlayerIdOrder() {
        battleRatingService.recordBattle(command("duel-2", BattleOutcome.PARTICIPANT_B_WON, null));

        InOrder lockOrder = inOrder(battleRatingRepository);
        lockOrder.verify(battleRatingRepository).findByPlayerIdAndCategoryForUpdate(PLAYER_B, BattleCategory.OSRS);
        lockOrder.verify(battleRatingRepository).findByPlayerIdAndCategoryForUpdate(PLAYER_A, BattleCategory.OSRS);
    }

    @Test
    void recordBattle_draw_leavesStreaksUntouched() {
        ratingA.setWinStreak(3);
        ratingA.setHighestWinStreak(3);
        ratingB.setLossStreak(2);

        battleRatingService.recordBattle(command("duel-3", BattleOutcome.DRAW, null));

        assertEquals(3, ratingA.getWinStreak());
        assertEquals(2, ratingB.getLossStreak());
        assertEquals(1, ratingA.getDraws());
        assertEquals(1, ratingB.getDraws());
        assertEquals(1000.0, ratingA.getRating(), 1e-9);
    }

    @Test
    void recordBattle_payloadDamage_accumulatesOnRatings() {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("turns", 14);
        payload.putObject("participant_a").put("damage_dealt", 87).put("damage_taken", 40);
        payload.putObject("participant_b").put("damage_dealt", 40).put("damage_taken", 87);

        BattleResult result = battleRatingService.recordBattle(command("duel-4", BattleOutcome.PARTICIPANT_A_WON, payload));

        assertEquals(87L, ratingA.getTotalDamageDealt());
        assertEquals(87L, ratingB.getTotalDamageTaken());
        assertEquals(14, result.record().getTurns());
    }

    @Test
    void recordBattle_replayedKey_returnsStoredRecordWithoutRating() {
        BattleRecord stored = storedRecord("duel-5", BattleOutcome.PARTICIPANT_A_WON);
        when(battleRecordRepository.findByBattleKey("duel-5")).thenReturn(Optional.of(stored));
        when(battleRatingRepository.findByPlayerIdAndCategory(PLAYER_A, BattleCategory.OSRS)).thenReturn(Optional.of(ratingA));
        when(battleRatingRepository.findByPlayerIdAndCategory(PLAYER_B, BattleCategory.OSRS)).thenReturn(Optional.of(ratingB));

        BattleResult result = battleRatingService.recordBattle(command("duel-5", BattleOutcome.PARTICIPANT_A_WON, null));

        assertTrue(result.replayed());
        assertSame(stored, result.record());
        assertNull(result.changeA());
        verify(battleRatingRepository, never()).findByPlayerIdAndCategoryForUpdate(any(), any());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    void recordBattle_reusedKeyForDifferentBattle_conflicts() {
        when(battleRecordRepository.findByBattleKey("duel-6"))
                .thenReturn(Optional.of(storedRecord("duel-6", BattleOutcome.PARTICIPANT_A_WON)));

        GameStateException ex = assertThrows(
                GameStateException.class,
                () -> battleRatingService.recordBattle(command("duel-6", BattleOutcome.PARTICIPANT_B_WON, null))
        );

        assertEquals("BATTLE_KEY_CONFLICT", ex.getCode());
    }

    @Test
    void recordBattle_sameParticipantTwice_rejected() {
        RecordBattleCommand selfBattle = new RecordBattleCommand(
                "duel-7", BattleCategory.OSRS, PLAYER_A, PLAYER_A, BattleOutcome.DRAW, null, null, null
        );

        GameStateException ex = assertThrows(GameStateException.class, () -> battleRatingService.recordBattle(selfBattle));

        assertEquals("SAME_PARTICIPANT", ex.getCode());
        verifyNoInteractions(transactionRetryExecutor);
    }

    @Test
    void recordBattle_payloadWithUnknownField_rejected() {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("loot", "dragon bones");

        GameStateException ex = assertThrows(
                GameStateException.class,
                () -> battleRatingService.recordBattle(command("duel-8", BattleOutcome.PARTICIPANT_A_WON, payload))
        );

        assertEquals("INVALID_OUTCOME_PAYLOAD", ex.getCode());
    }

    @Test
    void recordBattle_suspendedParticipant_rejected() {
        Player suspended = player(PLAYER_B);
        suspended.setStatus(PlayerStatus.BANNED);
        when(playerRepository.findById(PLAYER_B)).thenReturn(Optional.of(suspended));

        GameStateException ex = assertThrows(
                GameStateException.class,
                () -> battleRatingService.recordBattle(command("duel-9", BattleOutcome.PARTICIPANT_A_WON, null))
        );

        assertEquals("PLAYER_NOT_ACTIVE", ex.getCode());
    }

    @Test
    void recordBattle_tournamentMatch_completesMatchWithWinner() {
        TournamentMatch match = new TournamentMatch();
        match.setId(77L);
        when(tournamentService.lockMatchForResult(77L, BattleCategory.OSRS, PLAYER_A, PLAYER_B, BattleOutcome.PARTICIPANT_A_WON))
                .thenReturn(match);
        RecordBattleCommand command = new RecordBattleCommand(
                "final-1", BattleCategory.OSRS, PLAYER_A, PLAYER_B, BattleOutcome.PARTICIPANT_A_WON, null, 77L, null
        );

        battleRatingService.recordBattle(command);

        verify(tournamentService).completeMatch(eq(match), eq(PLAYER_A), eq(900L), any());
    }

    private static RecordBattleCommand command(String key, BattleOutcome outcome, ObjectNode payload) {
        return new RecordBattleCommand(key, BattleCategory.OSRS, PLAYER_A, PLAYER_B, outcome, payload, null, null);
    }

    private static BattleRecord storedRecord(String key, BattleOutcome outcome) {
        BattleRecord record = new BattleRecord();
        record.setId(500L);
        record.setBattleKey(key);
        record.setCategory(BattleCategory.OSRS);
        record.setParticipantAId(PLAYER_A);
        record.setParticipantBId(PLAYER_B);
        record.setOutcome(outcome);
        return record;
    }

    private static BattleRating rating(Long playerId) {
        BattleRating rating = new BattleRating();
        rating.setPlayerId(playerId);
        rating.setCategory(BattleCategory.OSRS);
        return rating;
    }

    private static Player player(Long id) {
        Player player = new Player();
        player.setId(id);
        return player;
    }
}
