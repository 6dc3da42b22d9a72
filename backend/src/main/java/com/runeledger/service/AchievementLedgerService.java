package com.runeledger.service;

import com.runeledger.model.AchievementCriterion;
import com.runeledger.model.AchievementDefinition;
import com.runeledger.model.BattleCategory;
import com.runeledger.model.PlayerAchievement;
import com.runeledger.repository.AchievementDefinitionRepository;
import com.runeledger.repository.PlayerAchievementRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * Write-once achievement markers. Awards are inserted with ON CONFLICT DO NOTHING, so replays and
 * concurrent evaluations never award twice and never fail on an existing row.
 */
@Service
@RequiredArgsConstructor
public class AchievementLedgerService {

    private static final Logger log = LoggerFactory.getLogger(AchievementLedgerService.class);

    private final AchievementDefinitionRepository achievementDefinitionRepository;
    private final PlayerAchievementRepository playerAchievementRepository;

    /**
     * @return true when this call created the marker
     */
    public boolean award(Long playerId, AchievementDefinition achievement, OffsetDateTime now) {
        boolean inserted = playerAchievementRepository.insertIfAbsent(playerId, achievement.getId(), now) == 1;
        if (inserted) {
            log.info("Player {} earned achievement {} ({})", playerId, achievement.getCode(), achievement.getName());
        }
        return inserted;
    }

    public List<AchievementDefinition> evaluateBattleAchievements(
            Long playerId,
            BattleCategory category,
            BattleStatLine stats,
            OffsetDateTime now
    ) {
        List<AchievementDefinition> awarded = new ArrayList<>();
        for (AchievementDefinition definition : achievementDefinitionRepository.findByBattleCategoryOrderByIdAsc(category)) {
            if (definition.getCriterion().isBattleCriterion()
                    && battleValue(definition.getCriterion(), stats) >= definition.getThreshold()
                    && award(playerId, definition, now)) {
                awarded.add(definition);
            }
        }
        return awarded;
    }

    @EventListener
    public void onDerivedStatsChanged(DerivedStatsChangedEvent event) {
        evaluateProgressionAchievements(event.playerId(), event.totalLevel(), event.combatLevel(), event.occurredAt());
    }

    public List<AchievementDefinition> evaluateProgressionAchievements(
            Long playerId,
            int totalLevel,
            int combatLevel,
            OffsetDateTime now
    ) {
        List<AchievementDefinition> awarded = new ArrayList<>();
        List<AchievementDefinition> definitions = achievementDefinitionRepository.findByCriterionInOrderByIdAsc(
                EnumSet.of(AchievementCriterion.TOTAL_LEVEL, AchievementCriterion.COMBAT_LEVEL)
        );
        for (AchievementDefinition definition : definitions) {
            int value = definition.getCriterion() == AchievementCriterion.TOTAL_LEVEL ? totalLevel : combatLevel;
            if (value >= definition.getThreshold() && award(playerId, definition, now)) {
                awarded.add(definition);
            }
        }
        return awarded;
    }

    @Transactional(readOnly = true)
    public List<PlayerAchievement> listPlayerAchievements(Long playerId) {
        return playerAchievementRepository.findByPlayerIdOrderByCompletedAtAscIdAsc(playerId);
    }

    @Transactional(readOnly = true)
    public List<AchievementDefinition> listDefinitions() {
        return achievementDefinitionRepository.findAll();
    }

    private static int battleValue(AchievementCriterion criterion, BattleStatLine stats) {
        return switch (criterion) {
            case WINS -> stats.wins();
            case WIN_STREAK -> stats.winStreak();
            case HIGHEST_STREAK -> stats.highestWinStreak();
            case TOTAL_BATTLES -> stats.totalBattles();
            default -> 0;
        };
    }
}
