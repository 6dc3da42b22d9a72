package com.runeledger.service;

import com.runeledger.model.ContainerSlot;
import com.runeledger.model.ContainerType;
import com.runeledger.model.ItemRequirement;
import com.runeledger.model.PlayerSkill;
import com.runeledger.repository.ContainerSlotRepository;
import com.runeledger.repository.PlayerQuestRepository;
import com.runeledger.repository.PlayerSkillRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks item and quest prerequisites against a player's current skills, quests and carried items.
 */
@Component
@RequiredArgsConstructor
public class RequirementEvaluator {

    private final PlayerSkillRepository playerSkillRepository;
    private final PlayerQuestRepository playerQuestRepository;
    private final ContainerSlotRepository containerSlotRepository;

    public List<ItemRequirement> unmetRequirements(Long playerId, List<ItemRequirement> requirements) {
        List<ItemRequirement> unmet = new ArrayList<>();
        for (ItemRequirement requirement : requirements) {
            if (!isMet(playerId, requirement)) {
                unmet.add(requirement);
            }
        }
        return unmet;
    }

    public static String describe(List<ItemRequirement> requirements) {
        List<String> parts = new ArrayList<>(requirements.size());
        for (ItemRequirement requirement : requirements) {
            parts.add(requirement.describe());
        }
        return String.join(", ", parts);
    }

    private boolean isMet(Long playerId, ItemRequirement requirement) {
        if (requirement instanceof ItemRequirement.Level level) {
            int current = playerSkillRepository.findByPlayerIdAndSkill(playerId, level.skill())
                    .map(PlayerSkill::getLevel)
                    .orElse(level.skill().getBaselineLevel());
            return current >= level.level();
        }
        if (requirement instanceof ItemRequirement.Quest quest) {
            return playerQuestRepository.existsByPlayerIdAndQuestId(playerId, quest.questId());
        }
        if (requirement instanceof ItemRequirement.Item item) {
            long carried = containerSlotRepository
                    .findByPlayerIdAndContainerAndItemIdOrderBySlotIndexAsc(playerId, ContainerType.INVENTORY, item.itemId())
                    .stream()
                    .mapToLong(ContainerSlot::getQuantity)
                    .sum();
            return carried >= item.quantity();
        }
        throw new IllegalArgumentException("Unsupported requirement: " + requirement);
    }
}
