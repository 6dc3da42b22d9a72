package com.runeledger.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

/**
 * Append-only fill between a buy and a sell order. Every column is insert-only.
 */
@Getter
@Setter
@Entity
@Table(name = "exchange_trades")
public class ExchangeTrade {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "item_id", nullable = false, updatable = false)
    private Integer itemId;

    @Column(name = "buy_order_id", nullable = false, updatable = false)
    private Long buyOrderId;

    @Column(name = "sell_order_id", nullable = false, updatable = false)
    private Long sellOrderId;

    @Column(name = "buyer_id", nullable = false, updatable = false)
    private Long buyerId;

    @Column(name = "seller_id", nullable = false, updatable = false)
    private Long sellerId;

    @Column(name = "quantity", nullable = false, updatable = false)
    private Integer quantity;

    @Column(name = "price_per_unit", nullable = false, updatable = false)
    private Long pricePerUnit;

    @Column(name = "executed_at", nullable = false, updatable = false)
    private OffsetDateTime executedAt;
}
