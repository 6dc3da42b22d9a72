package com.runeledger.arena.model;

public enum TournamentMatchStatus {
    PENDING,
    SCHEDULED,
    COMPLETED
}
