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
        name = "player_quests",
        uniqueConstraints = @UniqueConstraint(columnNames = {"player_id", "quest_id"})
)
public class PlayerQuest {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "player_id", nullable = false, updatable = false)
    private Long playerId;

    @Column(name = "quest_id", nullable = false, updatable = false)
    private Integer questId;

    @Column(name = "completed_at", nullable = false, updatable = false)
    private OffsetDateTime completedAt = OffsetDateTime.now();
}
