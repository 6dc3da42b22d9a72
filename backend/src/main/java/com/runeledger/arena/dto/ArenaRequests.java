package com.runeledger.arena.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.runeledger.arena.model.BattleOutcome;
import com.runeledger.model.BattleCategory;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.time.OffsetDateTime;

public final class ArenaRequests {

    private ArenaRequests() {
    }

    public record RecordBattleRequest(
            @NotBlank(message = "battleKey is required")
            @Size(max = 128, message = "battleKey must be at most 128 characters")
            String battleKey,

            @NotNull(message = "category is required")
            BattleCategory category,

            @NotNull(message = "participantAId is required")
            @Positive(message = "participantAId must be positive")
            Long participantAId,

            @NotNull(message = "participantBId is required")
            @Positive(message = "participantBId must be positive")
            Long participantBId,

            @NotNull(message = "outcome is required")
            BattleOutcome outcome,

            JsonNode outcomePayload,

            @Positive(message = "tournamentMatchId must be positive")
            Long tournamentMatchId,

            OffsetDateTime startedAt
    ) {
        @AssertTrue(message = "participantAId and participantBId must differ")
        public boolean isDistinctParticipants() {
            if (participantAId == null || participantBId == null) {
                return true;
            }
            return !participantAId.equals(participantBId);
        }
    }

    public record CreateTournamentRequest(
            @NotBlank(message = "name is required")
            @Size(max = 128, message = "name must be at most 128 characters")
            String name,

            @NotNull(message = "category is required")
            BattleCategory category,

            @Min(value = 2, message = "maxParticipants must be at least 2")
            @Max(value = 1024, message = "maxParticipants must be at most 1024")
            Integer maxParticipants
    ) {
    }

    public record RegisterParticipantRequest(
            @NotNull(message = "playerId is required")
            @Positive(message = "playerId must be positive")
            Long playerId
    ) {
    }

    public record ScheduleMatchRequest(
            OffsetDateTime scheduledAt
    ) {
    }
}
