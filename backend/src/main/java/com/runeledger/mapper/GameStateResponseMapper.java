package com.runeledger.mapper;

import com.runeledger.arena.model.BattleRating;
import com.runeledger.dto.ExchangeResponses;
import com.runeledger.dto.LedgerResponses;
import com.runeledger.dto.PlayerResponses;
import com.runeledger.dto.ProgressionResponses;
import com.runeledger.model.AchievementDefinition;
import com.runeledger.model.CollectionLogEntry;
import com.runeledger.model.ContainerSlot;
import com.runeledger.model.ExchangeOrder;
import com.runeledger.model.ExchangeTrade;
import com.runeledger.model.ItemDefinition;
import com.runeledger.model.Player;
import com.runeledger.model.PlayerAchievement;
import com.runeledger.model.PlayerEquipment;
import com.runeledger.model.PlayerQuest;
import com.runeledger.model.PlayerSkill;
import com.runeledger.model.QuestDefinition;
import com.runeledger.service.CollectionLogResult;
import com.runeledger.service.DailyPriceSummary;
import com.runeledger.service.EquipResult;
import com.runeledger.service.OrderBookDepth;
import com.runeledger.service.OrderSubmissionResult;
import com.runeledger.service.PlayerPurgeReport;
import com.runeledger.service.PlayerSnapshot;
import com.runeledger.service.QuestCompletionResult;
import com.runeledger.service.SkillUpdateResult;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;

@Component
public class GameStateResponseMapper {

    public PlayerResponses.Player toPlayerResponse(Player player) {
        return new PlayerResponses.Player(
                player.getId(),
                player.getAccountId(),
                player.getDisplayName(),
                player.getWorld(),
                player.isMember(),
                player.getGameMode(),
                player.getStatus(),
                player.getCoins(),
                player.getTotalLevel(),
                player.getCombatLevel(),
                player.getQuestPoints(),
                player.getCreatedAt(),
                player.getUpdatedAt(),
                player.getLastLoginAt()
        );
    }

    public PlayerResponses.Skill toSkillResponse(PlayerSkill skill) {
        return new PlayerResponses.Skill(
                skill.getSkill(),
                skill.getLevel(),
                skill.getExperience(),
                skill.getLastTrainedAt()
        );
    }

    public PlayerResponses.SkillUpdate toSkillUpdateResponse(SkillUpdateResult result) {
        return new PlayerResponses.SkillUpdate(
                result.playerId(),
                result.skill(),
                result.previousLevel(),
                result.newLevel(),
                result.previousExperience(),
                result.newExperience(),
                result.totalLevel(),
                result.combatLevel()
        );
    }

    public PlayerResponses.Snapshot toSnapshotResponse(PlayerSnapshot snapshot) {
        return new PlayerResponses.Snapshot(
                toPlayerResponse(snapshot.player()),
                snapshot.skills().stream().map(this::toSkillResponse).toList(),
                toSlotResponses(snapshot.inventory()),
                toSlotResponses(snapshot.bank()),
                toEquipmentResponses(snapshot.equipment()),
                snapshot.ratings().stream().map(this::toRatingResponse).toList(),
                snapshot.achievements().stream().map(this::toEarnedAchievementResponse).toList(),
                snapshot.quests().stream().map(this::toCompletedQuestResponse).toList(),
                snapshot.collectionLog().stream().map(this::toCollectionEntryResponse).toList()
        );
    }

    public PlayerResponses.PurgeReport toPurgeReportResponse(PlayerPurgeReport report) {
        return new PlayerResponses.PurgeReport(
                report.playerId(),
                report.deletions().stream()
                        .map(deletion -> new PlayerResponses.PurgeReport.StoreDeletion(
                                deletion.storeName(),
                                deletion.rowsDeleted()
                        ))
                        .toList(),
                report.totalRowsDeleted()
        );
    }

    public LedgerResponses.Slot toSlotResponse(ContainerSlot slot) {
        if (slot == null) {
            return null;
        }
        return new LedgerResponses.Slot(
                slot.getContainer(),
                slot.getSlotIndex(),
                slot.getItemId(),
                slot.getQuantity()
        );
    }

    public List<LedgerResponses.Slot> toSlotResponses(Collection<ContainerSlot> slots) {
        return slots.stream().map(this::toSlotResponse).toList();
    }

    public LedgerResponses.Equipment toEquipmentResponse(PlayerEquipment equipment) {
        return new LedgerResponses.Equipment(
                equipment.getSlot(),
                equipment.getItemId(),
                equipment.getQuantity()
        );
    }

    public List<LedgerResponses.Equipment> toEquipmentResponses(Collection<PlayerEquipment> equipment) {
        return equipment.stream().map(this::toEquipmentResponse).toList();
    }

    public LedgerResponses.EquipOutcome toEquipOutcomeResponse(EquipResult result) {
        return new LedgerResponses.EquipOutcome(
                toEquipmentResponse(result.equipment()),
                result.inventorySlot(),
                result.swappedOutItemId()
        );
    }

    public LedgerResponses.Coins toCoinsResponse(Player player) {
        return new LedgerResponses.Coins(player.getId(), player.getCoins());
    }

    public LedgerResponses.Item toItemResponse(ItemDefinition item) {
        return new LedgerResponses.Item(
                item.getId(),
                item.getName(),
                item.getDescription(),
                item.isTradeable(),
                item.isStackable(),
                item.isEquipable(),
                item.isMembers(),
                item.getEquipmentSlot(),
                item.getBaseValue(),
                item.getHighAlch(),
                item.getLowAlch(),
                item.getWeight(),
                item.getBuyLimit(),
                item.getRequirementsJson()
        );
    }

    public ExchangeResponses.Order toOrderResponse(ExchangeOrder order) {
        return new ExchangeResponses.Order(
                order.getId(),
                order.getPlayerId(),
                order.getItemId(),
                order.getSide(),
                order.getQuantity(),
                order.getQuantityFilled(),
                order.remainingQuantity(),
                order.getPricePerUnit(),
                order.getStatus(),
                order.getCreatedAt(),
                order.getUpdatedAt(),
                order.getCompletedAt(),
                order.getCancelledAt()
        );
    }

    public List<ExchangeResponses.Order> toOrderResponses(Collection<ExchangeOrder> orders) {
        return orders.stream().map(this::toOrderResponse).toList();
    }

    public ExchangeResponses.Trade toTradeResponse(ExchangeTrade trade) {
        return new ExchangeResponses.Trade(
                trade.getId(),
                trade.getItemId(),
                trade.getBuyOrderId(),
                trade.getSellOrderId(),
                trade.getBuyerId(),
                trade.getSellerId(),
                trade.getQuantity(),
                trade.getPricePerUnit(),
                trade.getExecutedAt()
        );
    }

    public List<ExchangeResponses.Trade> toTradeResponses(Collection<ExchangeTrade> trades) {
        return trades.stream().map(this::toTradeResponse).toList();
    }

    public ExchangeResponses.Submission toSubmissionResponse(OrderSubmissionResult result) {
        return new ExchangeResponses.Submission(
                toOrderResponse(result.order()),
                toTradeResponses(result.trades()),
                result.coinsRefunded()
        );
    }

    public ExchangeResponses.Depth toDepthResponse(OrderBookDepth depth) {
        return new ExchangeResponses.Depth(
                depth.itemId(),
                depth.bids().stream().map(this::toDepthLevelResponse).toList(),
                depth.asks().stream().map(this::toDepthLevelResponse).toList(),
                depth.lastTradePrice(),
                depth.priceTrend(),
                depth.dailyVolume()
        );
    }

    public ExchangeResponses.DailySummary toDailySummaryResponse(DailyPriceSummary summary) {
        return new ExchangeResponses.DailySummary(
                summary.date(),
                summary.averagePrice(),
                summary.lowPrice(),
                summary.highPrice(),
                summary.volume(),
                summary.tradeCount()
        );
    }

    public ProgressionResponses.CollectionEntry toCollectionEntryResponse(CollectionLogEntry entry) {
        return new ProgressionResponses.CollectionEntry(
                entry.getItemId(),
                entry.getQuantityObtained(),
                entry.getFirstObtainedAt(),
                entry.getLastObtainedAt()
        );
    }

    public ProgressionResponses.ObtainedOutcome toObtainedOutcomeResponse(CollectionLogResult result) {
        return new ProgressionResponses.ObtainedOutcome(
                result.playerId(),
                result.itemId(),
                result.firstTime(),
                result.replayed(),
                result.quantityObtained(),
                result.firstObtainedAt(),
                result.lastObtainedAt()
        );
    }

    public ProgressionResponses.Quest toQuestResponse(QuestDefinition quest) {
        return new ProgressionResponses.Quest(
                quest.getId(),
                quest.getName(),
                quest.getDifficulty(),
                quest.getQuestPoints(),
                quest.getRequirementsJson()
        );
    }

    public ProgressionResponses.CompletedQuest toCompletedQuestResponse(PlayerQuest quest) {
        return new ProgressionResponses.CompletedQuest(quest.getQuestId(), quest.getCompletedAt());
    }

    public ProgressionResponses.QuestCompletion toQuestCompletionResponse(QuestCompletionResult result) {
        return new ProgressionResponses.QuestCompletion(
                result.playerId(),
                result.questId(),
                result.newlyCompleted(),
                result.questPointsAwarded(),
                result.questPointsTotal()
        );
    }

    public ProgressionResponses.Achievement toAchievementResponse(AchievementDefinition definition) {
        return new ProgressionResponses.Achievement(
                definition.getId(),
                definition.getCode(),
                definition.getName(),
                definition.getDescription(),
                definition.getCategory(),
                definition.getBattleCategory(),
                definition.getCriterion(),
                definition.getThreshold(),
                definition.getPoints()
        );
    }

    public ProgressionResponses.EarnedAchievement toEarnedAchievementResponse(PlayerAchievement achievement) {
        return new ProgressionResponses.EarnedAchievement(achievement.getAchievementId(), achievement.getCompletedAt());
    }

    private PlayerResponses.Rating toRatingResponse(BattleRating rating) {
        return new PlayerResponses.Rating(
                rating.getCategory(),
                rating.getRating(),
                rating.getUncertainty(),
                rating.getWins(),
                rating.getLosses(),
                rating.getDraws(),
                rating.getWinStreak(),
                rating.getHighestWinStreak()
        );
    }

    private ExchangeResponses.DepthLevel toDepthLevelResponse(OrderBookDepth.Level level) {
        return new ExchangeResponses.DepthLevel(level.pricePerUnit(), level.quantity(), level.orderCount());
    }
}
