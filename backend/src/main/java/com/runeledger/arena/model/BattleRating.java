package com.runeledger.arena.model;

import com.runeledger.model.BattleCategory;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

@Getter
@Setter
@Entity
@Table(
        name = "battle_ratings",
        uniqueConstraints = @UniqueConstraint(columnNames = {"player_id", "category"})
)
public class BattleRating {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "player_id", nullable = false, updatable = false)
    private Long playerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", nullable = false, length = 16, updatable = false)
    private BattleCategory category;

    @Column(name = "rating", nullable = false)
    private Double rating = 1000.0;

    @Column(name = "uncertainty", nullable = false)
    private Double uncertainty = 350.0;

    /**
     * Uncertainty as it stood right after the last battle; inactivity growth is computed from it.
     */
    @Column(name = "last_battle_uncertainty", nullable = false)
    private Double lastBattleUncertainty = 350.0;

    @Column(name = "wins", nullable = false)
    private Integer wins = 0;

    @Column(name = "losses", nullable = false)
    private Integer losses = 0;

    @Column(name = "draws", nullable = false)
    private Integer draws = 0;

    @Column(name = "total_battles", nullable = false)
    private Integer totalBattles = 0;

    @Column(name = "win_streak", nullable = false)
    private Integer winStreak = 0;

    @Column(name = "loss_streak", nullable = false)
    private Integer lossStreak = 0;

    @Column(name = "highest_win_streak", nullable = false)
    private Integer highestWinStreak = 0;

    @Column(name = "total_damage_dealt", nullable = false)
    private Long totalDamageDealt = 0L;

    @Column(name = "total_damage_taken", nullable = false)
    private Long totalDamageTaken = 0L;

    @Column(name = "last_battle_at")
    private OffsetDateTime lastBattleAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
