package com.runeledger.service;

import com.runeledger.model.Player;
import com.runeledger.model.PlayerSkill;
import com.runeledger.model.SkillType;
import com.runeledger.repository.PlayerRepository;
import com.runeledger.repository.PlayerSkillRepository;
import com.runeledger.web.ErrorCategory;
import com.runeledger.web.GameStateException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Optional;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SkillProgressionServiceTest {

    private static final Long PLAYER_ID = 42L;

    @Mock
    private PlayerRepository playerRepository;

    @Mock
    private PlayerSkillRepository playerSkillRepository;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @Mock
    private TransactionRetryExecutor transactionRetryExecutor;

    @InjectMocks
    private SkillProgressionService skillProgressionService;

    @Test
    void addSkillExperience_crossingThreshold_levelsUpAndPublishesEvent() {
        runInline();
        when(playerRepository.findByIdForUpdate(PLAYER_ID)).thenReturn(Optional.of(player()));
        PlayerSkill woodcutting = skill(SkillType.WOODCUTTING, 1, 0L);
        when(playerSkillRepository.findByPlayerIdAndSkill(PLAYER_ID, SkillType.WOODCUTTING))
                .thenReturn(Optional.of(woodcutting));

        SkillUpdateResult result = skillProgressionService.addSkillExperience(PLAYER_ID, SkillType.WOODCUTTING, 83L);

        assertEquals(1, result.previousLevel());
        assertEquals(2, result.newLevel());
        assertEquals(83L, result.newExperience());
        assertEquals(2, woodcutting.getLevel());
        verify(playerSkillRepository).save(woodcutting);

        ArgumentCaptor<SkillExperienceChangedEvent> event = ArgumentCaptor.forClass(SkillExperienceChangedEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertEquals(SkillType.WOODCUTTING, event.getValue().skill());
        assertTrue(event.getValue().levelChanged());
    }

    @Test
    void addSkillExperience_nearCap_saturatesAtMaximum() {
        runInline();
        when(playerRepository.findByIdForUpdate(PLAYER_ID)).thenReturn(Optional.of(player()));
        PlayerSkill fishing = skill(SkillType.FISHING, 99, ExperienceTable.MAX_EXPERIENCE - 10);
        when(playerSkillRepository.findByPlayerIdAndSkill(PLAYER_ID, SkillType.FISHING))
                .thenReturn(Optional.of(fishing));

        SkillUpdateResult result = skillProgressionService.addSkillExperience(PLAYER_ID, SkillType.FISHING, 5_000L);

        assertEquals(ExperienceTable.MAX_EXPERIENCE, result.newExperience());
        assertEquals(99, result.newLevel());
    }

    @Test
    void addSkillExperience_nonPositiveDelta_rejectedBeforeAnyWrite() {
        GameStateException ex = assertThrows(
                GameStateException.class,
                () -> skillProgressionService.addSkillExperience(PLAYER_ID, SkillType.MINING, 0L)
        );

        assertEquals("INVALID_EXPERIENCE_DELTA", ex.getCode());
        verifyNoInteractions(transactionRetryExecutor, playerSkillRepository, eventPublisher);
    }

    @Test
    void updateSkillExperience_lowerValue_rejectedAsRegression() {
        runInline();
        when(playerRepository.findByIdForUpdate(PLAYER_ID)).thenReturn(Optional.of(player()));
        when(playerSkillRepository.findByPlayerIdAndSkill(PLAYER_ID, SkillType.ATTACK))
                .thenReturn(Optional.of(skill(SkillType.ATTACK, 10, 1_154L)));

        GameStateException ex = assertThrows(
                GameStateException.class,
                () -> skillProgressionService.updateSkillExperience(PLAYER_ID, SkillType.ATTACK, 500L)
        );

        assertEquals(ErrorCategory.INVARIANT_VIOLATION, ex.getCategory());
        assertEquals("EXPERIENCE_REGRESSION", ex.getCode());
        verify(playerSkillRepository, never()).save(any());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    void updateSkillExperience_outOfRange_rejected() {
        GameStateException ex = assertThrows(
                GameStateException.class,
                () -> skillProgressionService.updateSkillExperience(
                        PLAYER_ID,
                        SkillType.ATTACK,
                        ExperienceTable.MAX_EXPERIENCE + 1
                )
        );

        assertEquals("EXPERIENCE_OUT_OF_RANGE", ex.getCode());
    }

    @Test
    void resetSkill_mayLowerExperience() {
        runInline();
        when(playerRepository.findByIdForUpdate(PLAYER_ID)).thenReturn(Optional.of(player()));
        PlayerSkill attack = skill(SkillType.ATTACK, 10, 1_154L);
        when(playerSkillRepository.findByPlayerIdAndSkill(PLAYER_ID, SkillType.ATTACK))
                .thenReturn(Optional.of(attack));

        SkillUpdateResult result = skillProgressionService.resetSkill(PLAYER_ID, SkillType.ATTACK, 0L);

        assertEquals(10, result.previousLevel());
        assertEquals(1, result.newLevel());
        assertEquals(0L, attack.getExperience());
    }

    @Test
    void addSkillExperience_missingRow_startsFromBaseline() {
        runInline();
        when(playerRepository.findByIdForUpdate(PLAYER_ID)).thenReturn(Optional.of(player()));
        when(playerSkillRepository.findByPlayerIdAndSkill(PLAYER_ID, SkillType.HITPOINTS))
                .thenReturn(Optional.empty());

        SkillUpdateResult result = skillProgressionService.addSkillExperience(PLAYER_ID, SkillType.HITPOINTS, 1L);

        assertEquals(10, result.previousLevel());
        assertEquals(1_155L, result.newExperience());
    }

    @Test
    void updateSkillExperience_unknownPlayer_notFound() {
        runInline();
        when(playerRepository.findByIdForUpdate(PLAYER_ID)).thenReturn(Optional.empty());

        GameStateException ex = assertThrows(
                GameStateException.class,
                () -> skillProgressionService.updateSkillExperience(PLAYER_ID, SkillType.COOKING, 100L)
        );

        assertEquals("PLAYER_NOT_FOUND", ex.getCode());
    }

    private void runInline() {
        when(transactionRetryExecutor.execute(anyString(), ArgumentMatchers.<Supplier<SkillUpdateResult>>any()))
                .thenAnswer(invocation -> invocation.<Supplier<SkillUpdateResult>>getArgument(1).get());
    }

    private static Player player() {
        Player player = new Player();
        player.setId(PLAYER_ID);
        player.setAccountId(7L);
        player.setDisplayName("Zezima");
        player.setTotalLevel(32);
        player.setCombatLevel(3);
        return player;
    }

    private static PlayerSkill skill(SkillType type, int level, long experience) {
        PlayerSkill row = new PlayerSkill();
        row.setPlayerId(PLAYER_ID);
        row.setSkill(type);
        row.setLevel(level);
        row.setExperience(experience);
        return row;
    }
}
