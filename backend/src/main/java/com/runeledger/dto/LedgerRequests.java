package com.runeledger.dto;

import com.runeledger.model.ContainerType;
import com.runeledger.model.EquipmentSlotType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

public final class LedgerRequests {

    private LedgerRequests() {
    }

    public record PlaceItemRequest(
            @NotNull(message = "container is required")
            ContainerType container,

            @NotNull(message = "slotIndex is required")
            @PositiveOrZero(message = "slotIndex must be non-negative")
            Integer slotIndex,

            @NotNull(message = "itemId is required")
            @Positive(message = "itemId must be positive")
            Integer itemId,

            @NotNull(message = "quantity is required")
            @Positive(message = "quantity must be positive")
            Integer quantity
    ) {
    }

    public record RemoveItemRequest(
            @NotNull(message = "container is required")
            ContainerType container,

            @NotNull(message = "slotIndex is required")
            @PositiveOrZero(message = "slotIndex must be non-negative")
            Integer slotIndex,

            @NotNull(message = "quantity is required")
            @Positive(message = "quantity must be positive")
            Integer quantity
    ) {
    }

    public record EquipRequest(
            @NotNull(message = "inventorySlot is required")
            @PositiveOrZero(message = "inventorySlot must be non-negative")
            Integer inventorySlot,

            EquipmentSlotType targetSlot
    ) {
    }

    public record UnequipRequest(
            @NotNull(message = "slot is required")
            EquipmentSlotType slot
    ) {
    }

    public record BankTransferRequest(
            @NotNull(message = "itemId is required")
            @Positive(message = "itemId must be positive")
            Integer itemId,

            @NotNull(message = "quantity is required")
            @Positive(message = "quantity must be positive")
            Integer quantity
    ) {
    }

    public record CoinAdjustmentRequest(
            @NotNull(message = "amount is required")
            @Positive(message = "amount must be positive")
            Long amount
    ) {
    }
}
