package com.runeledger.service;

import com.runeledger.model.PlayerEquipment;

/**
 * @param swappedOutItemId item previously worn in the slot and now in the vacated inventory slot, if any
 */
public record EquipResult(
        PlayerEquipment equipment,
        Integer inventorySlot,
        Integer swappedOutItemId
) {
}
