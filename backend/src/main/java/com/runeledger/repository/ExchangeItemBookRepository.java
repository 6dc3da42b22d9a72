package com.runeledger.repository;

import com.runeledger.model.ExchangeItemBook;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ExchangeItemBookRepository extends JpaRepository<ExchangeItemBook, Integer> {

    @Modifying
    @Query(
            value = """
                    INSERT INTO exchange_item_books (item_id, daily_volume, price_trend, updated_at)
                    VALUES (:itemId, 0, 'STABLE', NOW())
                    ON CONFLICT (item_id) DO NOTHING
                    """,
            nativeQuery = true
    )
    int insertIfAbsent(@Param("itemId") Integer itemId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select b from ExchangeItemBook b where b.itemId = :itemId")
    Optional<ExchangeItemBook> findByItemIdForUpdate(@Param("itemId") Integer itemId);
}
