package com.runeledger.arena.repository;

import com.runeledger.arena.model.BattleRating;
import com.runeledger.model.BattleCategory;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface BattleRatingRepository extends JpaRepository<BattleRating, Long> {
    List<BattleRating> findByPlayerIdOrderByCategoryAsc(Long playerId);

    Optional<BattleRating> findByPlayerIdAndCategory(Long playerId, BattleCategory category);

    List<BattleRating> findByCategoryAndPlayerIdIn(BattleCategory category, Collection<Long> playerIds);

    List<BattleRating> findByCategoryOrderByRatingDescPlayerIdAsc(BattleCategory category, Pageable pageable);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from BattleRating r where r.playerId = :playerId and r.category = :category")
    Optional<BattleRating> findByPlayerIdAndCategoryForUpdate(
            @Param("playerId") Long playerId,
            @Param("category") BattleCategory category
    );

    @Query("""
            select distinct r.playerId from BattleRating r
            where r.lastBattleAt is not null and r.lastBattleAt < :cutoff and r.playerId > :afterPlayerId
            order by r.playerId asc
            """)
    List<Long> findIdlePlayerIdsAfter(
            @Param("cutoff") OffsetDateTime cutoff,
            @Param("afterPlayerId") Long afterPlayerId,
            Pageable pageable
    );

    /**
     * Locks idle rows in the same player-id order {@code recordBattle} uses.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            select r from BattleRating r
            where r.playerId in :playerIds and r.lastBattleAt is not null and r.lastBattleAt < :cutoff
            order by r.playerId asc, r.category asc
            """)
    List<BattleRating> findIdleByPlayerIdsForUpdate(
            @Param("playerIds") Collection<Long> playerIds,
            @Param("cutoff") OffsetDateTime cutoff
    );

    @Modifying
    @Query(
            value = """
                    INSERT INTO battle_ratings
                        (player_id, category, rating, uncertainty, last_battle_uncertainty, created_at, updated_at)
                    VALUES (:playerId, :category, :rating, :uncertainty, :uncertainty, NOW(), NOW())
                    ON CONFLICT (player_id, category) DO NOTHING
                    """,
            nativeQuery = true
    )
    int insertIfAbsent(
            @Param("playerId") Long playerId,
            @Param("category") String category,
            @Param("rating") double rating,
            @Param("uncertainty") double uncertainty
    );

    @Modifying
    @Query("delete from BattleRating r where r.playerId = :playerId")
    int deleteAllByPlayerId(@Param("playerId") Long playerId);
}
