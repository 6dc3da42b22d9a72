package com.runeledger.arena.model;

public enum TournamentStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED
}
