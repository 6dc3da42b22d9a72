package com.runeledger.repository;

import com.runeledger.model.Player;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface PlayerRepository extends JpaRepository<Player, Long> {
    Optional<Player> findByAccountId(Long accountId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from Player p where p.id = :playerId")
    Optional<Player> findByIdForUpdate(@Param("playerId") Long playerId);

    @Modifying
    @Query("delete from Player p where p.id = :playerId")
    int deletePlayerById(@Param("playerId") Long playerId);
}
