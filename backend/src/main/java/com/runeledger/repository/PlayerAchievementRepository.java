package com.runeledger.repository;

import com.runeledger.model.PlayerAchievement;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;

@Repository
public interface PlayerAchievementRepository extends JpaRepository<PlayerAchievement, Long> {
    List<PlayerAchievement> findByPlayerIdOrderByCompletedAtAscIdAsc(Long playerId);

    @Modifying
    @Query(
            value = """
                    INSERT INTO player_achievements (player_id, achievement_id, completed_at)
                    VALUES (:playerId, :achievementId, :completedAt)
                    ON CONFLICT (player_id, achievement_id) DO NOTHING
                    """,
            nativeQuery = true
    )
    int insertIfAbsent(
            @Param("playerId") Long playerId,
            @Param("achievementId") Integer achievementId,
            @Param("completedAt") OffsetDateTime completedAt
    );

    @Modifying
    @Query("delete from PlayerAchievement a where a.playerId = :playerId")
    int deleteAllByPlayerId(@Param("playerId") Long playerId);
}
