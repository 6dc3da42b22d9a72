package com.runeledger.repository;

import com.runeledger.model.PlayerQuest;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;

@Repository
public interface PlayerQuestRepository extends JpaRepository<PlayerQuest, Long> {
    boolean existsByPlayerIdAndQuestId(Long playerId, Integer questId);

    List<PlayerQuest> findByPlayerIdOrderByCompletedAtAscIdAsc(Long playerId);

    @Modifying
    @Query(
            value = """
                    INSERT INTO player_quests (player_id, quest_id, completed_at)
                    VALUES (:playerId, :questId, :completedAt)
                    ON CONFLICT (player_id, quest_id) DO NOTHING
                    """,
            nativeQuery = true
    )
    int insertIfAbsent(
            @Param("playerId") Long playerId,
            @Param("questId") Integer questId,
            @Param("completedAt") OffsetDateTime completedAt
    );

    @Modifying
    @Query("delete from PlayerQuest q where q.playerId = :playerId")
    int deleteAllByPlayerId(@Param("playerId") Long playerId);
}
