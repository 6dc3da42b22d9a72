package com.runeledger.repository;

public interface OrderBookLevelRow {

    Long getPricePerUnit();

    Long getRemainingQuantity();

    Long getOrderCount();
}
