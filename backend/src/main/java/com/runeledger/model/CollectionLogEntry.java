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
        name = "collection_log_entries",
        uniqueConstraints = @UniqueConstraint(columnNames = {"player_id", "item_id"})
)
public class CollectionLogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "player_id", nullable = false, updatable = false)
    private Long playerId;

    @Column(name = "item_id", nullable = false, updatable = false)
    private Integer itemId;

    @Column(name = "quantity_obtained", nullable = false)
    private Long quantityObtained = 0L;

    @Column(name = "first_obtained_at", nullable = false, updatable = false)
    private OffsetDateTime firstObtainedAt;

    @Column(name = "last_obtained_at", nullable = false)
    private OffsetDateTime lastObtainedAt;
}
