package com.runeledger.model;

public enum GameMode {
    NORMAL,
    IRONMAN,
    HARDCORE_IRONMAN,
    ULTIMATE_IRONMAN
}
