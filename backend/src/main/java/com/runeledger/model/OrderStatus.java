package com.runeledger.model;

public enum OrderStatus {
    ACTIVE,
    COMPLETED,
    CANCELLED
}
