package com.runeledger.model;

import com.fasterxml.jackson.databind.JsonNode;
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
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;

/**
 * Item catalog entry. Reference data seeded by migration; never written by the engine.
 */
@Getter
@Setter
@Entity
@Table(name = "items")
public class ItemDefinition {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Column(name = "name", nullable = false, unique = true)
    private String name;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "tradeable", nullable = false)
    private boolean tradeable = true;

    @Column(name = "stackable", nullable = false)
    private boolean stackable = false;

    @Column(name = "equipable", nullable = false)
    private boolean equipable = false;

    @Column(name = "members", nullable = false)
    private boolean members = false;

    @Enumerated(EnumType.STRING)
    @Column(name = "equipment_slot", length = 16)
    private EquipmentSlotType equipmentSlot;

    @Column(name = "base_value", nullable = false)
    private Integer baseValue = 0;

    @Column(name = "high_alch")
    private Integer highAlch;

    @Column(name = "low_alch")
    private Integer lowAlch;

    @Column(name = "weight", precision = 10, scale = 2)
    private BigDecimal weight;

    @Column(name = "buy_limit")
    private Integer buyLimit;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "requirements_json", nullable = false, columnDefinition = "jsonb")
    private JsonNode requirementsJson;
}
