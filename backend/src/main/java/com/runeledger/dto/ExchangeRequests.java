package com.runeledger.dto;

import com.runeledger.model.OrderSide;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public final class ExchangeRequests {

    private ExchangeRequests() {
    }

    public record SubmitOrderRequest(
            @NotNull(message = "playerId is required")
            @Positive(message = "playerId must be positive")
            Long playerId,

            @NotNull(message = "itemId is required")
            @Positive(message = "itemId must be positive")
            Integer itemId,

            @NotNull(message = "side is required")
            OrderSide side,

            @NotNull(message = "quantity is required")
            @Positive(message = "quantity must be positive")
            Integer quantity,

            @NotNull(message = "pricePerUnit is required")
            @Positive(message = "pricePerUnit must be positive")
            Long pricePerUnit
    ) {
    }

    public record CancelOrderRequest(
            @NotNull(message = "playerId is required")
            @Positive(message = "playerId must be positive")
            Long playerId
    ) {
    }
}
