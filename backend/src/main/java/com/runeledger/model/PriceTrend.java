package com.runeledger.model;

public enum PriceTrend {
    RISING,
    FALLING,
    STABLE
}
