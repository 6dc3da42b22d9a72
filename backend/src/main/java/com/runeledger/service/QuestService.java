package com.runeledger.service;

import com.runeledger.model.ItemRequirement;
import com.runeledger.model.ItemRequirementJsonCodec;
import com.runeledger.model.Player;
import com.runeledger.model.PlayerQuest;
import com.runeledger.model.QuestDefinition;
import com.runeledger.repository.PlayerQuestRepository;
import com.runeledger.repository.PlayerRepository;
import com.runeledger.repository.QuestDefinitionRepository;
import com.runeledger.web.GameStateException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;

@Service
@RequiredArgsConstructor
public class QuestService {

    private static final Logger log = LoggerFactory.getLogger(QuestService.class);

    private final QuestDefinitionRepository questDefinitionRepository;
    private final PlayerQuestRepository playerQuestRepository;
    private final PlayerRepository playerRepository;
    private final RequirementEvaluator requirementEvaluator;
    private final TransactionRetryExecutor transactionRetryExecutor;

    /**
     * Marks a quest complete and credits its quest points exactly once. Completing an already
     * completed quest succeeds without crediting again.
     */
    public QuestCompletionResult completeQuest(Long playerId, Integer questId) {
        return transactionRetryExecutor.execute("completeQuest", () -> {
            Player player = playerRepository.findByIdForUpdate(playerId)
                    .orElseThrow(() -> GameStateException.playerNotFound(playerId));
            QuestDefinition quest = questDefinitionRepository.findById(questId)
                    .orElseThrow(() -> GameStateException.notFound("QUEST_NOT_FOUND", "Quest not found: " + questId));

            if (playerQuestRepository.existsByPlayerIdAndQuestId(playerId, questId)) {
                return new QuestCompletionResult(playerId, questId, false, 0, player.getQuestPoints());
            }

            List<ItemRequirement> unmet = requirementEvaluator.unmetRequirements(
                    playerId,
                    ItemRequirementJsonCodec.fromJson(quest.getRequirementsJson())
            );
            if (!unmet.isEmpty()) {
                throw GameStateException.requirementsNotMet(
                        quest.getName() + " requires " + RequirementEvaluator.describe(unmet)
                );
            }

            OffsetDateTime now = OffsetDateTime.now();
            if (playerQuestRepository.insertIfAbsent(playerId, questId, now) == 0) {
                return new QuestCompletionResult(playerId, questId, false, 0, player.getQuestPoints());
            }
            player.setQuestPoints(player.getQuestPoints() + quest.getQuestPoints());
            player.setUpdatedAt(now);
            playerRepository.save(player);
            log.info(
                    "Player {} completed quest {} (+{} quest points, total {})",
                    playerId,
                    quest.getName(),
                    quest.getQuestPoints(),
                    player.getQuestPoints()
            );
            return new QuestCompletionResult(playerId, questId, true, quest.getQuestPoints(), player.getQuestPoints());
        });
    }

    @Transactional(readOnly = true)
    public List<QuestDefinition> listQuests() {
        return questDefinitionRepository.findAllByOrderByIdAsc();
    }

    @Transactional(readOnly = true)
    public List<PlayerQuest> listCompleted(Long playerId) {
        return playerQuestRepository.findByPlayerIdOrderByCompletedAtAscIdAsc(playerId);
    }
}
