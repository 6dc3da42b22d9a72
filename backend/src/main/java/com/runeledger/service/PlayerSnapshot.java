package com.runeledger.service;

import com.runeledger.arena.model.BattleRating;
import com.runeledger.model.CollectionLogEntry;
import com.runeledger.model.ContainerSlot;
import com.runeledger.model.Player;
import com.runeledger.model.PlayerAchievement;
import com.runeledger.model.PlayerEquipment;
import com.runeledger.model.PlayerQuest;
import com.runeledger.model.PlayerSkill;

import java.util.List;

public record PlayerSnapshot(
        Player player,
        List<PlayerSkill> skills,
        List<ContainerSlot> inventory,
        List<ContainerSlot> bank,
        List<PlayerEquipment> equipment,
        List<BattleRating> ratings,
        List<PlayerAchievement> achievements,
        List<PlayerQuest> quests,
        List<CollectionLogEntry> collectionLog
) {
}
