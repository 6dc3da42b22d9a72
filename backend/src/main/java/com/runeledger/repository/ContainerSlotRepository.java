package com.runeledger.repository;

import com.runeledger.model.ContainerSlot;
import com.runeledger.model.ContainerType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ContainerSlotRepository extends JpaRepository<ContainerSlot, Long> {
    List<ContainerSlot> findByPlayerIdAndContainerOrderBySlotIndexAsc(Long playerId, ContainerType container);

    Optional<ContainerSlot> findByPlayerIdAndContainerAndSlotIndex(
            Long playerId,
            ContainerType container,
            Integer slotIndex
    );

    List<ContainerSlot> findByPlayerIdAndContainerAndItemIdOrderBySlotIndexAsc(
            Long playerId,
            ContainerType container,
            Integer itemId
    );

    @Modifying
    @Query("delete from ContainerSlot s where s.playerId = :playerId")
    int deleteAllByPlayerId(@Param("playerId") Long playerId);
}
