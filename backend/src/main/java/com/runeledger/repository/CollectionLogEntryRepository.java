package com.runeledger.repository;

import com.runeledger.model.CollectionLogEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface CollectionLogEntryRepository extends JpaRepository<CollectionLogEntry, Long> {
    Optional<CollectionLogEntry> findByPlayerIdAndItemId(Long playerId, Integer itemId);

    List<CollectionLogEntry> findByPlayerIdOrderByFirstObtainedAtAscIdAsc(Long playerId);

    @Modifying
    @Query(
            value = """
                    INSERT INTO collection_log_entries
                        (player_id, item_id, quantity_obtained, first_obtained_at, last_obtained_at)
                    VALUES (:playerId, :itemId, :quantity, :obtainedAt, :obtainedAt)
                    ON CONFLICT (player_id, item_id) DO UPDATE
                    SET quantity_obtained = collection_log_entries.quantity_obtained + EXCLUDED.quantity_obtained,
                        last_obtained_at = EXCLUDED.last_obtained_at
                    """,
            nativeQuery = true
    )
    int upsertObtained(
            @Param("playerId") Long playerId,
            @Param("itemId") Integer itemId,
            @Param("quantity") long quantity,
            @Param("obtainedAt") OffsetDateTime obtainedAt
    );

    @Modifying
    @Query("delete from CollectionLogEntry c where c.playerId = :playerId")
    int deleteAllByPlayerId(@Param("playerId") Long playerId);
}
