package com.runeledger.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public final class ProgressionRequests {

    private ProgressionRequests() {
    }

    public record RecordObtainedRequest(
            @NotNull(message = "itemId is required")
            @Positive(message = "itemId must be positive")
            Integer itemId,

            @NotNull(message = "quantity is required")
            @Positive(message = "quantity must be positive")
            Long quantity,

            @NotBlank(message = "dropKey is required")
            @Size(max = 128, message = "dropKey must be at most 128 characters")
            String dropKey
    ) {
    }

    public record CompleteQuestRequest(
            @NotNull(message = "questId is required")
            @Positive(message = "questId must be positive")
            Integer questId
    ) {
    }
}
