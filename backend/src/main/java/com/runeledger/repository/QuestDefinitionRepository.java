package com.runeledger.repository;

import com.runeledger.model.QuestDefinition;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface QuestDefinitionRepository extends JpaRepository<QuestDefinition, Integer> {
    List<QuestDefinition> findAllByOrderByIdAsc();
}
