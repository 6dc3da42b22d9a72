package com.runeledger.model;

public enum BattleCategory {
    OSRS,
    POKEMON,
    PET
}
