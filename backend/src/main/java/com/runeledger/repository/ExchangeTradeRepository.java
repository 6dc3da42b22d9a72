package com.runeledger.repository;

import com.runeledger.model.ExchangeTrade;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;

@Repository
public interface ExchangeTradeRepository extends JpaRepository<ExchangeTrade, Long> {
    List<ExchangeTrade> findByItemIdAndExecutedAtGreaterThanEqualOrderByExecutedAtAscIdAsc(
            Integer itemId,
            OffsetDateTime since
    );

    @Query("""
            select coalesce(sum(t.quantity), 0)
            from ExchangeTrade t
            where t.buyOrderId = :orderId or t.sellOrderId = :orderId
            """)
    long sumQuantityByOrderId(@Param("orderId") Long orderId);
}
