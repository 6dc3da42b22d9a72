package com.runeledger.model;

public enum ContainerType {
    INVENTORY,
    BANK
}
