package com.runeledger.arena.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.runeledger.model.BattleCategory;
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

import java.time.OffsetDateTime;

/**
 * Immutable record of one battle. Participants are raw player ids so history outlives purged players.
 */
@Getter
@Setter
@Entity
@Table(name = "battle_records")
public class BattleRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "battle_key", nullable = false, unique = true, length = 128, updatable = false)
    private String battleKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", nullable = false, length = 16, updatable = false)
    private BattleCategory category;

    @Column(name = "participant_a_id", nullable = false, updatable = false)
    private Long participantAId;

    @Column(name = "participant_b_id", nullable = false, updatable = false)
    private Long participantBId;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false, length = 32, updatable = false)
    private BattleOutcome outcome;

    @Column(name = "winner_id", updatable = false)
    private Long winnerId;

    @Column(name = "turns", nullable = false, updatable = false)
    private Integer turns = 0;

    @Column(name = "duration_seconds", nullable = false, updatable = false)
    private Integer durationSeconds = 0;

    @Column(name = "tournament_match_id", updatable = false)
    private Long tournamentMatchId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "outcome_payload", nullable = false, columnDefinition = "jsonb", updatable = false)
    private JsonNode outcomePayload;

    @Column(name = "started_at", updatable = false)
    private OffsetDateTime startedAt;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private OffsetDateTime recordedAt;
}
