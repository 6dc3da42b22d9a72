package com.runeledger.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
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
        name = "player_achievements",
        uniqueConstraints = @UniqueConstraint(columnNames = {"player_id", "achievement_id"})
)
public class PlayerAchievement {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "player_id", nullable = false, updatable = false)
    private Long playerId;

    @Column(name = "achievement_id", nullable = false, updatable = false)
    private Integer achievementId;

    @Column(name = "completed_at", nullable = false, updatable = false)
    private OffsetDateTime completedAt;
}
