package com.runeledger.model;

public enum QuestDifficulty {
    NOVICE,
    INTERMEDIATE,
    EXPERIENCED,
    MASTER,
    GRANDMASTER
}
