package com.runeledger.arena.model;

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
        name = "tournament_matches",
        uniqueConstraints = @UniqueConstraint(columnNames = {"tournament_id", "round", "bracket_position"})
)
public class TournamentMatch {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tournament_id", nullable = false, updatable = false)
    private Long tournamentId;

    @Column(name = "round", nullable = false, updatable = false)
    private Integer round;

    @Column(name = "bracket_position", nullable = false, updatable = false)
    private Integer bracketPosition;

    @Column(name = "participant_a_id", nullable = false, updatable = false)
    private Long participantAId;

    /**
     * Null for a bye.
     */
    @Column(name = "participant_b_id", updatable = false)
    private Long participantBId;

    @Column(name = "bye", nullable = false, updatable = false)
    private boolean bye = false;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private TournamentMatchStatus status = TournamentMatchStatus.PENDING;

    @Column(name = "winner_id")
    private Long winnerId;

    @Column(name = "battle_record_id")
    private Long battleRecordId;

    @Column(name = "scheduled_at")
    private OffsetDateTime scheduledAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    public boolean involves(Long playerId) {
        return playerId != null && (playerId.equals(participantAId) || playerId.equals(participantBId));
    }
}
