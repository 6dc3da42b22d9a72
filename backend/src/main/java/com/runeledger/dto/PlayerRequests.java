package com.runeledger.dto;

import com.runeledger.model.GameMode;
import com.runeledger.model.PlayerStatus;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

public final class PlayerRequests {

    private PlayerRequests() {
    }

    public record RegisterPlayerRequest(
            @NotNull(message = "accountId is required")
            @Positive(message = "accountId must be positive")
            Long accountId,

            @NotBlank(message = "displayName is required")
            @Size(max = 32, message = "displayName must be at most 32 characters")
            String displayName,

            @Min(value = 301, message = "world must be between 301 and 580")
            @Max(value = 580, message = "world must be between 301 and 580")
            Integer world,

            Boolean member,

            GameMode gameMode
    ) {
    }

    public record UpdateStatusRequest(
            @NotNull(message = "status is required")
            PlayerStatus status
    ) {
    }

    public record SetExperienceRequest(
            @NotNull(message = "experience is required")
            @PositiveOrZero(message = "experience must be non-negative")
            @Max(value = 200_000_000L, message = "experience must be at most 200000000")
            Long experience
    ) {
    }

    public record AddExperienceRequest(
            @NotNull(message = "delta is required")
            @Positive(message = "delta must be positive")
            @Max(value = 200_000_000L, message = "delta must be at most 200000000")
            Long delta
    ) {
    }
}
