package com.runeledger.model;

public enum PlayerStatus {
    ACTIVE,
    INACTIVE,
    BANNED
}
