package com.runeledger.repository;

import com.runeledger.model.CollectionLogDrop;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CollectionLogDropRepository extends JpaRepository<CollectionLogDrop, Long> {
    Optional<CollectionLogDrop> findByPlayerIdAndDropKey(Long playerId, String dropKey);

    @Modifying
    @Query("delete from CollectionLogDrop d where d.playerId = :playerId")
    int deleteAllByPlayerId(@Param("playerId") Long playerId);
}
