package com.runeledger.service;

import com.runeledger.arena.repository.BattleRatingRepository;
import com.runeledger.model.ContainerType;
import com.runeledger.model.GameMode;
import com.runeledger.model.Player;
import com.runeledger.model.PlayerSkill;
import com.runeledger.model.PlayerStatus;
import com.runeledger.model.SkillType;
import com.runeledger.repository.CollectionLogEntryRepository;
import com.runeledger.repository.ContainerSlotRepository;
import com.runeledger.repository.PlayerAchievementRepository;
import com.runeledger.repository.PlayerEquipmentRepository;
import com.runeledger.repository.PlayerQuestRepository;
import com.runeledger.repository.PlayerRepository;
import com.runeledger.repository.PlayerSkillRepository;
import com.runeledger.web.GameStateException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

@Service
@RequiredArgsConstructor
public class PlayerService {

    private static final Logger log = LoggerFactory.getLogger(PlayerService.class);

    private final PlayerRepository playerRepository;
    private final PlayerSkillRepository playerSkillRepository;
    private final ContainerSlotRepository containerSlotRepository;
    private final PlayerEquipmentRepository playerEquipmentRepository;
    private final PlayerAchievementRepository playerAchievementRepository;
    private final PlayerQuestRepository playerQuestRepository;
    private final CollectionLogEntryRepository collectionLogEntryRepository;
    private final BattleRatingRepository battleRatingRepository;
    private final DerivedStatRecomputationListener derivedStatRecomputationListener;
    private final TransactionRetryExecutor transactionRetryExecutor;

    /**
     * Returns the player bound to {@code accountId}, creating it with baseline skills on first contact.
     * A concurrent first contact for the same account loses the unique-key race and is replayed,
     * which then finds the winner's row.
     */
    public Player registerPlayer(Long accountId, String displayName, Integer world, Boolean member, GameMode gameMode) {
        if (accountId == null) {
            throw GameStateException.validation("ACCOUNT_ID_REQUIRED", "accountId is required");
        }
        if (displayName == null || displayName.isBlank()) {
            throw GameStateException.validation("DISPLAY_NAME_REQUIRED", "displayName is required");
        }
        return transactionRetryExecutor.execute(
                "registerPlayer",
                () -> registerInTransaction(accountId, displayName.trim(), world, member, gameMode),
                List.of(DataIntegrityViolationException.class)
        );
    }

    private Player registerInTransaction(
            Long accountId,
            String displayName,
            Integer world,
            Boolean member,
            GameMode gameMode
    ) {
        OffsetDateTime now = OffsetDateTime.now();
        Player existing = playerRepository.findByAccountId(accountId).orElse(null);
        if (existing != null) {
            existing.setLastLoginAt(now);
            existing.setUpdatedAt(now);
            return playerRepository.save(existing);
        }

        Player player = new Player();
        player.setAccountId(accountId);
        player.setDisplayName(displayName);
        player.setWorld(world != null ? world : Player.DEFAULT_WORLD);
        player.setMember(Boolean.TRUE.equals(member));
        player.setGameMode(gameMode != null ? gameMode : GameMode.NORMAL);
        player.setStatus(PlayerStatus.ACTIVE);
        player.setCreatedAt(now);
        player.setUpdatedAt(now);
        player.setLastLoginAt(now);
        Player saved = playerRepository.saveAndFlush(player);

        List<PlayerSkill> skills = new ArrayList<>(SkillType.values().length);
        for (SkillType skill : SkillType.values()) {
            skills.add(baselineSkill(saved.getId(), skill, now));
        }
        playerSkillRepository.saveAll(skills);

        derivedStatRecomputationListener.recompute(saved, true, now);
        log.info(
                "Registered player {} for account {} (total level {}, combat level {})",
                saved.getId(),
                accountId,
                saved.getTotalLevel(),
                saved.getCombatLevel()
        );
        return saved;
    }

    @Transactional(readOnly = true)
    public Player getPlayer(Long playerId) {
        return playerRepository.findById(playerId)
                .orElseThrow(() -> GameStateException.playerNotFound(playerId));
    }

    @Transactional(readOnly = true)
    public Player getPlayerByAccountId(Long accountId) {
        return playerRepository.findByAccountId(accountId)
                .orElseThrow(() -> GameStateException.notFound(
                        "PLAYER_NOT_FOUND",
                        "No player registered for account " + accountId
                ));
    }

    @Transactional(readOnly = true)
    public PlayerSnapshot getSnapshot(Long playerId) {
        Player player = getPlayer(playerId);
        return new PlayerSnapshot(
                player,
                playerSkillRepository.findByPlayerIdOrderByIdAsc(playerId),
                containerSlotRepository.findByPlayerIdAndContainerOrderBySlotIndexAsc(playerId, ContainerType.INVENTORY),
                containerSlotRepository.findByPlayerIdAndContainerOrderBySlotIndexAsc(playerId, ContainerType.BANK),
                playerEquipmentRepository.findByPlayerIdOrderByIdAsc(playerId),
                battleRatingRepository.findByPlayerIdOrderByCategoryAsc(playerId),
                playerAchievementRepository.findByPlayerIdOrderByCompletedAtAscIdAsc(playerId),
                playerQuestRepository.findByPlayerIdOrderByCompletedAtAscIdAsc(playerId),
                collectionLogEntryRepository.findByPlayerIdOrderByFirstObtainedAtAscIdAsc(playerId)
        );
    }

    /**
     * Soft status change. Inactive and banned players keep every row but may not trade or battle.
     */
    public Player updateStatus(Long playerId, PlayerStatus status) {
        if (status == null) {
            throw GameStateException.validation("STATUS_REQUIRED", "status is required");
        }
        return transactionRetryExecutor.execute("updatePlayerStatus", () -> {
            Player player = playerRepository.findByIdForUpdate(playerId)
                    .orElseThrow(() -> GameStateException.playerNotFound(playerId));
            if (player.getStatus() == status) {
                return player;
            }
            PlayerStatus previous = player.getStatus();
            player.setStatus(status);
            player.setUpdatedAt(OffsetDateTime.now());
            log.info("Player {} status {} -> {}", playerId, previous, status);
            return playerRepository.save(player);
        });
    }

    public static void requireActive(Player player) {
        if (player.getStatus() != PlayerStatus.ACTIVE) {
            throw GameStateException.playerNotActive(
                    "Player " + player.getId() + " is " + player.getStatus()
            );
        }
    }

    static PlayerSkill baselineSkill(Long playerId, SkillType skill, OffsetDateTime now) {
        PlayerSkill row = new PlayerSkill();
        row.setPlayerId(playerId);
        row.setSkill(skill);
        row.setLevel(skill.getBaselineLevel());
        row.setExperience(ExperienceTable.experienceForLevel(skill.getBaselineLevel()));
        row.setUpdatedAt(now);
        return row;
    }
}
