package com.runeledger.service;

import com.runeledger.model.AchievementCriterion;
import com.runeledger.model.AchievementDefinition;
import com.runeledger.model.BattleCategory;
import com.runeledger.repository.AchievementDefinitionRepository;
import com.runeledger.repository.PlayerAchievementRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AchievementLedgerServiceTest {

    private static final Long PLAYER_ID = 3L;
    private static final OffsetDateTime NOW = OffsetDateTime.parse("2026-05-10T08:30:00Z");

    @Mock
    private AchievementDefinitionRepository achievementDefinitionRepository;

    @Mock
    private PlayerAchievementRepository playerAchievementRepository;

    @InjectMocks
    private AchievementLedgerService achievementLedgerService;

    @Test
    void award_existingMarker_reportsNotInserted() {
        AchievementDefinition firstBlood = definition(1, "FIRST_BLOOD", AchievementCriterion.WINS, 1);
        when(playerAchievementRepository.insertIfAbsent(PLAYER_ID, 1, NOW)).thenReturn(0);

        assertFalse(achievementLedgerService.award(PLAYER_ID, firstBlood, NOW));
    }

    @Test
    void evaluateBattleAchievements_awardsOnlyThresholdsReached() {
        AchievementDefinition firstWin = definition(1, "OSRS_FIRST_WIN", AchievementCriterion.WINS, 1);
        AchievementDefinition streak = definition(2, "OSRS_STREAK_5", AchievementCriterion.WIN_STREAK, 5);
        AchievementDefinition veteran = definition(3, "OSRS_VETERAN", AchievementCriterion.TOTAL_BATTLES, 3);
        when(achievementDefinitionRepository.findByBattleCategoryOrderByIdAsc(BattleCategory.OSRS))
                .thenReturn(List.of(firstWin, streak, veteran));
        when(playerAchievementRepository.insertIfAbsent(PLAYER_ID, 1, NOW)).thenReturn(1);
        when(playerAchievementRepository.insertIfAbsent(PLAYER_ID, 3, NOW)).thenReturn(1);

        List<AchievementDefinition> awarded = achievementLedgerService.evaluateBattleAchievements(
                PLAYER_ID,
                BattleCategory.OSRS,
                new BattleStatLine(2, 2, 2, 3),
                NOW
        );

        assertEquals(List.of(firstWin, veteran), awarded);
        verify(playerAchievementRepository, never()).insertIfAbsent(PLAYER_ID, 2, NOW);
    }

    @Test
    void evaluateBattleAchievements_replayedEvaluation_awardsNothingNew() {
        AchievementDefinition firstWin = definition(1, "OSRS_FIRST_WIN", AchievementCriterion.WINS, 1);
        when(achievementDefinitionRepository.findByBattleCategoryOrderByIdAsc(BattleCategory.OSRS))
                .thenReturn(List.of(firstWin));
        when(playerAchievementRepository.insertIfAbsent(PLAYER_ID, 1, NOW)).thenReturn(0);

        List<AchievementDefinition> awarded = achievementLedgerService.evaluateBattleAchievements(
                PLAYER_ID,
                BattleCategory.OSRS,
                new BattleStatLine(4, 1, 3, 6),
                NOW
        );

        assertTrue(awarded.isEmpty());
    }

    @Test
    void evaluateProgressionAchievements_usesTotalAndCombatThresholds() {
        AchievementDefinition baseSeventy = definition(10, "TOTAL_1610", AchievementCriterion.TOTAL_LEVEL, 1610);
        AchievementDefinition maxed = definition(11, "TOTAL_2277", AchievementCriterion.TOTAL_LEVEL, 2277);
        AchievementDefinition combat100 = definition(12, "COMBAT_100", AchievementCriterion.COMBAT_LEVEL, 100);
        when(achievementDefinitionRepository.findByCriterionInOrderByIdAsc(
                EnumSet.of(AchievementCriterion.TOTAL_LEVEL, AchievementCriterion.COMBAT_LEVEL)
        )).thenReturn(List.of(baseSeventy, maxed, combat100));
        when(playerAchievementRepository.insertIfAbsent(PLAYER_ID, 10, NOW)).thenReturn(1);
        when(playerAchievementRepository.insertIfAbsent(PLAYER_ID, 12, NOW)).thenReturn(1);

        List<AchievementDefinition> awarded = achievementLedgerService.evaluateProgressionAchievements(
                PLAYER_ID,
                1700,
                104,
                NOW
        );

        assertEquals(List.of(baseSeventy, combat100), awarded);
    }

    @Test
    void evaluateBattleAchievements_noDefinitions_neverWrites() {
        when(achievementDefinitionRepository.findByBattleCategoryOrderByIdAsc(BattleCategory.PET))
                .thenReturn(List.of());

        achievementLedgerService.evaluateBattleAchievements(PLAYER_ID, BattleCategory.PET, new BattleStatLine(9, 9, 9, 9), NOW);

        verify(playerAchievementRepository, never()).insertIfAbsent(anyLong(), anyInt(), any());
    }

    private static AchievementDefinition definition(int id, String code, AchievementCriterion criterion, int threshold) {
        AchievementDefinition definition = new AchievementDefinition();
        definition.setId(id);
        definition.setCode(code);
        definition.setName(code);
        definition.setCriterion(criterion);
        definition.setThreshold(threshold);
        return definition;
    }
}
