package com.runeledger.repository;

import com.runeledger.model.ItemDefinition;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ItemDefinitionRepository extends JpaRepository<ItemDefinition, Integer> {
    List<ItemDefinition> findAllByOrderByIdAsc();
}
