package com.runeledger.service;

import com.runeledger.model.Player;
import com.runeledger.model.PlayerSkill;
import com.runeledger.model.SkillType;
import com.runeledger.repository.PlayerRepository;
import com.runeledger.repository.PlayerSkillRepository;
import com.runeledger.web.GameStateException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps {@code players.total_level} and {@code players.combat_level} equal to the functions of the
 * player's skill rows. Runs synchronously inside the transaction that changed the skill, under the
 * player row lock that transaction already holds.
 */
@Component
@RequiredArgsConstructor
public class DerivedStatRecomputationListener {

    private static final Logger log = LoggerFactory.getLogger(DerivedStatRecomputationListener.class);

    private final PlayerRepository playerRepository;
    private final PlayerSkillRepository playerSkillRepository;
    private final ApplicationEventPublisher eventPublisher;

    @EventListener
    public void onSkillExperienceChanged(SkillExperienceChangedEvent event) {
        Player player = playerRepository.findByIdForUpdate(event.playerId())
                .orElseThrow(() -> GameStateException.playerNotFound(event.playerId()));
        recompute(player, event.skill().isCombatRelevant() && event.levelChanged(), event.occurredAt());
    }

    /**
     * Recomputes the derived fields of a locked player. Combat level is only touched when
     * {@code includeCombat} is set.
     */
    public Player recompute(Player player, boolean includeCombat, OffsetDateTime now) {
        List<PlayerSkill> skills = playerSkillRepository.findByPlayerIdOrderByIdAsc(player.getId());
        Map<SkillType, Integer> levels = new EnumMap<>(SkillType.class);
        int totalLevel = 0;
        for (PlayerSkill skill : skills) {
            levels.put(skill.getSkill(), skill.getLevel());
            totalLevel += skill.getLevel();
        }

        int previousTotal = player.getTotalLevel() == null ? 0 : player.getTotalLevel();
        int previousCombat = player.getCombatLevel() == null ? 0 : player.getCombatLevel();
        int combatLevel = includeCombat ? CombatLevelCalculator.combatLevel(levels) : previousCombat;

        if (totalLevel == previousTotal && combatLevel == previousCombat) {
            return player;
        }

        player.setTotalLevel(totalLevel);
        player.setCombatLevel(combatLevel);
        player.setUpdatedAt(now);
        playerRepository.save(player);

        log.debug(
                "Recomputed derived stats for player {}: total {} -> {}, combat {} -> {}",
                player.getId(),
                previousTotal,
                totalLevel,
                previousCombat,
                combatLevel
        );
        eventPublisher.publishEvent(new DerivedStatsChangedEvent(player.getId(), totalLevel, combatLevel, now));
        return player;
    }
}
