package com.runeledger.model;

public enum AchievementCategory {
    BATTLE,
    SKILLING,
    COMBAT
}
