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

@Getter
@Setter
@Entity
@Table(name = "achievement_definitions")
public class AchievementDefinition {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Column(name = "code", nullable = false, unique = true, length = 64)
    private String code;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", nullable = false, length = 32)
    private AchievementCategory category;

    /**
     * Battle category the criterion is counted in; null for progression achievements.
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "battle_category", length = 16)
    private BattleCategory battleCategory;

    @Enumerated(EnumType.STRING)
    @Column(name = "criterion", nullable = false, length = 32)
    private AchievementCriterion criterion;

    @Column(name = "threshold", nullable = false)
    private Integer threshold;

    @Column(name = "points", nullable = false)
    private Integer points = 0;
}
