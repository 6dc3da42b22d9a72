package com.runeledger.repository;

import com.runeledger.model.AchievementCriterion;
import com.runeledger.model.AchievementDefinition;
import com.runeledger.model.BattleCategory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface AchievementDefinitionRepository extends JpaRepository<AchievementDefinition, Integer> {
    List<AchievementDefinition> findByBattleCategoryOrderByIdAsc(BattleCategory battleCategory);

    List<AchievementDefinition> findByCriterionInOrderByIdAsc(Collection<AchievementCriterion> criteria);
}
