package com.runeledger.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

@Getter
@Setter
@Entity
@Table(name = "players")
public class Player {

    public static final int DEFAULT_WORLD = 301;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "account_id", nullable = false, unique = true, updatable = false)
    private Long accountId;

    @Column(name = "display_name", nullable = false, length = 64)
    private String displayName;

    @Column(name = "world", nullable = false)
    private Integer world = DEFAULT_WORLD;

    @Column(name = "member", nullable = false)
    private boolean member = false;

    @Enumerated(EnumType.STRING)
    @Column(name = "game_mode", nullable = false, length = 32)
    private GameMode gameMode = GameMode.NORMAL;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private PlayerStatus status = PlayerStatus.ACTIVE;

    @Column(name = "coins", nullable = false)
    private long coins = 0L;

    @Column(name = "total_level", nullable = false)
    private Integer totalLevel = 0;

    @Column(name = "combat_level", nullable = false)
    private Integer combatLevel = 3;

    @Column(name = "quest_points", nullable = false)
    private Integer questPoints = 0;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    @Column(name = "last_login_at")
    private OffsetDateTime lastLoginAt;
}
