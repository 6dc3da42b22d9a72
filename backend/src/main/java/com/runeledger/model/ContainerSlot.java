package com.runeledger.model;

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

/**
 * One occupied inventory or bank slot. Empty slots have no row.
 */
@Getter
@Setter
@Entity
@Table(
        name = "player_container_slots",
        uniqueConstraints = @UniqueConstraint(columnNames = {"player_id", "container", "slot_index"})
)
public class ContainerSlot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "player_id", nullable = false, updatable = false)
    private Long playerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "container", nullable = false, length = 16, updatable = false)
    private ContainerType container;

    @Column(name = "slot_index", nullable = false, updatable = false)
    private Integer slotIndex;

    @Column(name = "item_id", nullable = false)
    private Integer itemId;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
