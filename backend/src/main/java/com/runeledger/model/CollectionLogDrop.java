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

/**
 * One applied collection-log drop, keyed by the caller's drop key so a replay is counted once.
 */
@Getter
@Setter
@Entity
@Table(
        name = "collection_log_drops",
        uniqueConstraints = @UniqueConstraint(columnNames = {"player_id", "drop_key"})
)
public class CollectionLogDrop {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "player_id", nullable = false, updatable = false)
    private Long playerId;

    @Column(name = "drop_key", nullable = false, length = 128, updatable = false)
    private String dropKey;

    @Column(name = "item_id", nullable = false, updatable = false)
    private Integer itemId;

    @Column(name = "quantity", nullable = false, updatable = false)
    private Long quantity;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private OffsetDateTime recordedAt;
}
