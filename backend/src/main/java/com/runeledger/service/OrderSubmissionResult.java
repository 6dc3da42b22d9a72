package com.runeledger.service;

import com.runeledger.model.ExchangeOrder;
import com.runeledger.model.ExchangeTrade;

import java.util.List;

public record OrderSubmissionResult(
        ExchangeOrder order,
        List<ExchangeTrade> trades,
        long coinsRefunded
) {
}
