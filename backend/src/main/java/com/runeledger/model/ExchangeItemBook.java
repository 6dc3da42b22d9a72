package com.runeledger.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;
import java.time.OffsetDateTime;

/**
 * Per-item market summary. Its row lock serializes order matching for the item.
 */
@Getter
@Setter
@Entity
@Table(name = "exchange_item_books")
public class ExchangeItemBook {

    @Id
    @Column(name = "item_id", nullable = false, updatable = false)
    private Integer itemId;

    @Column(name = "last_trade_price")
    private Long lastTradePrice;

    @Column(name = "previous_trade_price")
    private Long previousTradePrice;

    @Column(name = "daily_volume", nullable = false)
    private Long dailyVolume = 0L;

    @Column(name = "volume_date")
    private LocalDate volumeDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "price_trend", nullable = false, length = 16)
    private PriceTrend priceTrend = PriceTrend.STABLE;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
