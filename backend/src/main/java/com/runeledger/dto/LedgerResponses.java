package com.runeledger.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.runeledger.model.ContainerType;
import com.runeledger.model.EquipmentSlotType;

import java.math.BigDecimal;
import java.util.List;

public final class LedgerResponses {

    private LedgerResponses() {
    }

    public record Slot(
            ContainerType container,
            Integer slotIndex,
            Integer itemId,
            Integer quantity
    ) {
    }

    public record Equipment(
            EquipmentSlotType slot,
            Integer itemId,
            Integer quantity
    ) {
    }

    public record EquipOutcome(
            Equipment equipment,
            Integer inventorySlot,
            Integer swappedOutItemId
    ) {
    }

    /**
     * @param slot the slot after removal, or null when it was emptied
     */
    public record RemoveOutcome(
            ContainerType container,
            Integer slotIndex,
            Slot slot
    ) {
    }

    public record Withdrawal(
            List<Slot> inventorySlots
    ) {
    }

    public record Coins(
            Long playerId,
            long coins
    ) {
    }

    public record Item(
            Integer itemId,
            String name,
            String description,
            boolean tradeable,
            boolean stackable,
            boolean equipable,
            boolean members,
            EquipmentSlotType equipmentSlot,
            Integer baseValue,
            Integer highAlch,
            Integer lowAlch,
            BigDecimal weight,
            Integer buyLimit,
            JsonNode requirements
    ) {
    }
}
