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
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.function.LongUnaryOperator;

/**
 * Source of truth for skill experience. Every write locks the owning player row, persists the
 * skill and publishes a {@link SkillExperienceChangedEvent} that recomputes derived stats in the
 * same transaction.
 */
@Service
@RequiredArgsConstructor
public class SkillProgressionService {

    private static final Logger log = LoggerFactory.getLogger(SkillProgressionService.class);

    private final PlayerRepository playerRepository;
    private final PlayerSkillRepository playerSkillRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final TransactionRetryExecutor transactionRetryExecutor;

    /**
     * Sets a skill's absolute experience. Lowering experience is rejected.
     */
    public SkillUpdateResult updateSkillExperience(Long playerId, SkillType skill, long experience) {
        validateExperience(experience);
        return transactionRetryExecutor.execute(
                "updateSkillExperience",
                () -> applyExperience(playerId, skill, current -> experience, false)
        );
    }

    /**
     * Adds training experience, saturating at the experience cap.
     */
    public SkillUpdateResult addSkillExperience(Long playerId, SkillType skill, long delta) {
        if (delta <= 0) {
            throw GameStateException.validation("INVALID_EXPERIENCE_DELTA", "experience gained must be positive");
        }
        return transactionRetryExecutor.execute(
                "addSkillExperience",
                () -> applyExperience(
                        playerId,
                        skill,
                        current -> Math.min(ExperienceTable.MAX_EXPERIENCE, current + delta),
                        false
                )
        );
    }

    /**
     * Administrative override; the only path that may lower experience.
     */
    public SkillUpdateResult resetSkill(Long playerId, SkillType skill, long experience) {
        validateExperience(experience);
        return transactionRetryExecutor.execute(
                "resetSkill",
                () -> applyExperience(playerId, skill, current -> experience, true)
        );
    }

    private SkillUpdateResult applyExperience(
            Long playerId,
            SkillType skill,
            LongUnaryOperator nextExperience,
            boolean allowRegression
    ) {
        if (skill == null) {
            throw GameStateException.validation("SKILL_REQUIRED", "skill is required");
        }
        Player player = playerRepository.findByIdForUpdate(playerId)
                .orElseThrow(() -> GameStateException.playerNotFound(playerId));
        OffsetDateTime now = OffsetDateTime.now();

        PlayerSkill row = playerSkillRepository.findByPlayerIdAndSkill(playerId, skill)
                .orElseGet(() -> PlayerService.baselineSkill(playerId, skill, now));

        long previousExperience = row.getExperience();
        int previousLevel = row.getLevel();
        long experience = nextExperience.applyAsLong(previousExperience);

        if (!allowRegression && experience < previousExperience) {
            throw GameStateException.experienceRegression(
                    "Experience for " + skill + " cannot decrease from " + previousExperience + " to " + experience
            );
        }

        int level = ExperienceTable.levelForExperience(experience);
        row.setExperience(experience);
        row.setLevel(level);
        if (experience > previousExperience) {
            row.setLastTrainedAt(now);
        }
        row.setUpdatedAt(now);
        playerSkillRepository.save(row);

        eventPublisher.publishEvent(new SkillExperienceChangedEvent(
                playerId,
                skill,
                previousLevel,
                level,
                previousExperience,
                experience,
                now
        ));

        if (level != previousLevel) {
            log.info(
                    "Player {} {} level {} -> {} ({} xp)",
                    playerId,
                    skill,
                    previousLevel,
                    level,
                    experience
            );
        }

        return new SkillUpdateResult(
                playerId,
                skill,
                previousLevel,
                level,
                previousExperience,
                experience,
                player.getTotalLevel(),
                player.getCombatLevel()
        );
    }

    private static void validateExperience(long experience) {
        if (!ExperienceTable.isValidExperience(experience)) {
            throw GameStateException.validation(
                    "EXPERIENCE_OUT_OF_RANGE",
                    "experience must be between 0 and " + ExperienceTable.MAX_EXPERIENCE
            );
        }
    }
}
