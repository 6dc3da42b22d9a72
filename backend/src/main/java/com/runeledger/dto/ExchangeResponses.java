package com.runeledger.dto;

import com.runeledger.model.OrderSide;
import com.runeledger.model.OrderStatus;
import com.runeledger.model.PriceTrend;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;

public final class ExchangeResponses {

    private ExchangeResponses() {
    }

    public record Order(
            Long orderId,
            Long playerId,
            Integer itemId,
            OrderSide side,
            Integer quantity,
            Integer quantityFilled,
            Integer quantityRemaining,
            Long pricePerUnit,
            OrderStatus status,
            OffsetDateTime createdAt,
            OffsetDateTime updatedAt,
            OffsetDateTime completedAt,
            OffsetDateTime cancelledAt
    ) {
    }

    public record Trade(
            Long tradeId,
            Integer itemId,
            Long buyOrderId,
            Long sellOrderId,
            Long buyerId,
            Long sellerId,
            Integer quantity,
            Long pricePerUnit,
            OffsetDateTime executedAt
    ) {
    }

    public record Submission(
            Order order,
            List<Trade> trades,
            long coinsRefunded
    ) {
    }

    public record DepthLevel(
            long pricePerUnit,
            long quantity,
            long orderCount
    ) {
    }

    public record Depth(
            Integer itemId,
            List<DepthLevel> bids,
            List<DepthLevel> asks,
            Long lastTradePrice,
            PriceTrend priceTrend,
            long dailyVolume
    ) {
    }

    public record DailySummary(
            LocalDate date,
            long averagePrice,
            long lowPrice,
            long highPrice,
            long volume,
            int tradeCount
    ) {
    }
}
