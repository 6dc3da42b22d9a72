package com.runeledger.service;

import com.runeledger.model.PriceTrend;

import java.util.List;

/**
 * @param bids buy levels, best (highest) price first
 * @param asks sell levels, best (lowest) price first
 */
public record OrderBookDepth(
        Integer itemId,
        List<Level> bids,
        List<Level> asks,
        Long lastTradePrice,
        PriceTrend priceTrend,
        long dailyVolume
) {
    public record Level(
            long pricePerUnit,
            long quantity,
            long orderCount
    ) {
    }
}
