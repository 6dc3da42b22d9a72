package com.runeledger.repository;

import com.runeledger.model.ExchangeOrder;
import com.runeledger.model.OrderSide;
import com.runeledger.model.OrderStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface ExchangeOrderRepository extends JpaRepository<ExchangeOrder, Long> {
    List<ExchangeOrder> findByPlayerIdOrderByCreatedAtDescIdDesc(Long playerId);

    List<ExchangeOrder> findByItemIdAndSideAndStatusAndPricePerUnitLessThanEqualOrderByPricePerUnitAscCreatedAtAscIdAsc(
            Integer itemId,
            OrderSide side,
            OrderStatus status,
            Long pricePerUnit
    );

    List<ExchangeOrder> findByItemIdAndSideAndStatusAndPricePerUnitGreaterThanEqualOrderByPricePerUnitDescCreatedAtAscIdAsc(
            Integer itemId,
            OrderSide side,
            OrderStatus status,
            Long pricePerUnit
    );

    long countByStatus(OrderStatus status);

    @Query("select o.itemId from ExchangeOrder o where o.id = :orderId")
    Optional<Integer> findItemIdById(@Param("orderId") Long orderId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select o from ExchangeOrder o where o.id = :orderId")
    Optional<ExchangeOrder> findByIdForUpdate(@Param("orderId") Long orderId);

    @Query("""
            select o.pricePerUnit as pricePerUnit,
                   sum(o.quantity - o.quantityFilled) as remainingQuantity,
                   count(o) as orderCount
            from ExchangeOrder o
            where o.itemId = :itemId and o.side = :side and o.status = :status
            group by o.pricePerUnit
            order by o.pricePerUnit asc
            """)
    List<OrderBookLevelRow> findDepthLevels(
            @Param("itemId") Integer itemId,
            @Param("side") OrderSide side,
            @Param("status") OrderStatus status
    );

    /**
     * Units a player has committed to buying since {@code since}; cancelled orders count only their filled part.
     */
    @Query("""
            select coalesce(sum(case when o.status = :cancelled then o.quantityFilled else o.quantity end), 0)
            from ExchangeOrder o
            where o.playerId = :playerId and o.itemId = :itemId and o.side = :side and o.createdAt >= :since
            """)
    long sumCommittedQuantitySince(
            @Param("playerId") Long playerId,
            @Param("itemId") Integer itemId,
            @Param("side") OrderSide side,
            @Param("cancelled") OrderStatus cancelled,
            @Param("since") OffsetDateTime since
    );

    @Modifying
    @Query("delete from ExchangeOrder o where o.playerId = :playerId")
    int deleteAllByPlayerId(@Param("playerId") Long playerId);
}
