package com.runeledger.service;

import java.time.LocalDate;

public record DailyPriceSummary(
        LocalDate date,
        long averagePrice,
        long lowPrice,
        long highPrice,
        long volume,
        int tradeCount
) {
}
