package com.runeledger.repository;

import com.runeledger.model.EquipmentSlotType;
import com.runeledger.model.PlayerEquipment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PlayerEquipmentRepository extends JpaRepository<PlayerEquipment, Long> {
    List<PlayerEquipment> findByPlayerIdOrderByIdAsc(Long playerId);

    Optional<PlayerEquipment> findByPlayerIdAndSlot(Long playerId, EquipmentSlotType slot);

    @Modifying
    @Query("delete from PlayerEquipment e where e.playerId = :playerId")
    int deleteAllByPlayerId(@Param("playerId") Long playerId);
}
