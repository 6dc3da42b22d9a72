package com.runeledger.config;

import com.runeledger.arena.repository.BattleRatingRepository;
import com.runeledger.repository.CollectionLogDropRepository;
import com.runeledger.repository.CollectionLogEntryRepository;
import com.runeledger.repository.ContainerSlotRepository;
import com.runeledger.repository.ExchangeOrderRepository;
import com.runeledger.repository.PlayerAchievementRepository;
import com.runeledger.repository.PlayerEquipmentRepository;
import com.runeledger.repository.PlayerQuestRepository;
import com.runeledger.repository.PlayerSkillRepository;
import com.runeledger.service.PlayerOwnedStore;
import com.runeledger.service.RepositoryPlayerOwnedStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Ownership graph of the player record. Foreign keys carry no cascades; purges walk these stores.
 */
@Configuration
public class PlayerOwnershipConfig {

    @Bean
    public PlayerOwnedStore exchangeOrderStore(ExchangeOrderRepository repository) {
        return new RepositoryPlayerOwnedStore("exchange_orders", 10, repository::deleteAllByPlayerId);
    }

    @Bean
    public PlayerOwnedStore battleRatingStore(BattleRatingRepository repository) {
        return new RepositoryPlayerOwnedStore("battle_ratings", 20, repository::deleteAllByPlayerId);
    }

    @Bean
    public PlayerOwnedStore achievementStore(PlayerAchievementRepository repository) {
        return new RepositoryPlayerOwnedStore("player_achievements", 30, repository::deleteAllByPlayerId);
    }

    @Bean
    public PlayerOwnedStore collectionLogStore(CollectionLogEntryRepository repository) {
        return new RepositoryPlayerOwnedStore("collection_log_entries", 40, repository::deleteAllByPlayerId);
    }

    @Bean
    public PlayerOwnedStore collectionLogDropStore(CollectionLogDropRepository repository) {
        return new RepositoryPlayerOwnedStore("collection_log_drops", 45, repository::deleteAllByPlayerId);
    }

    @Bean
    public PlayerOwnedStore questStore(PlayerQuestRepository repository) {
        return new RepositoryPlayerOwnedStore("player_quests", 50, repository::deleteAllByPlayerId);
    }

    @Bean
    public PlayerOwnedStore equipmentStore(PlayerEquipmentRepository repository) {
        return new RepositoryPlayerOwnedStore("player_equipment", 60, repository::deleteAllByPlayerId);
    }

    @Bean
    public PlayerOwnedStore containerSlotStore(ContainerSlotRepository repository) {
        return new RepositoryPlayerOwnedStore("player_container_slots", 70, repository::deleteAllByPlayerId);
    }

    @Bean
    public PlayerOwnedStore skillStore(PlayerSkillRepository repository) {
        return new RepositoryPlayerOwnedStore("player_skills", 80, repository::deleteAllByPlayerId);
    }
}
