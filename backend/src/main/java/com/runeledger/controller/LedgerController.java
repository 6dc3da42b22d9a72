package com.runeledger.controller;

import com.runeledger.dto.LedgerRequests;
import com.runeledger.dto.LedgerResponses;
import com.runeledger.mapper.GameStateResponseMapper;
import com.runeledger.model.ContainerSlot;
import com.runeledger.model.ContainerType;
import com.runeledger.service.ItemLedgerService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API for the item catalog, inventory, bank, equipment and coin balance.
 */
@RestController
@RequestMapping("/api")
public class LedgerController {

    private final ItemLedgerService itemLedgerService;
    private final GameStateResponseMapper responseMapper;

    public LedgerController(ItemLedgerService itemLedgerService, GameStateResponseMapper responseMapper) {
        this.itemLedgerService = itemLedgerService;
        this.responseMapper = responseMapper;
    }

    @GetMapping("/items")
    public ResponseEntity<List<LedgerResponses.Item>> listItems() {
        return ResponseEntity.ok(itemLedgerService.listItems().stream().map(responseMapper::toItemResponse).toList());
    }

    @GetMapping("/items/{itemId}")
    public ResponseEntity<LedgerResponses.Item> getItem(@PathVariable Integer itemId) {
        return ResponseEntity.ok(responseMapper.toItemResponse(itemLedgerService.getItem(itemId)));
    }

    @GetMapping("/players/{playerId}/inventory")
    public ResponseEntity<List<LedgerResponses.Slot>> getInventory(@PathVariable Long playerId) {
        return ResponseEntity.ok(responseMapper.toSlotResponses(
                itemLedgerService.listContainer(playerId, ContainerType.INVENTORY)
        ));
    }

    @GetMapping("/players/{playerId}/bank")
    public ResponseEntity<List<LedgerResponses.Slot>> getBank(@PathVariable Long playerId) {
        return ResponseEntity.ok(responseMapper.toSlotResponses(
                itemLedgerService.listContainer(playerId, ContainerType.BANK)
        ));
    }

    @GetMapping("/players/{playerId}/equipment")
    public ResponseEntity<List<LedgerResponses.Equipment>> getEquipment(@PathVariable Long playerId) {
        return ResponseEntity.ok(responseMapper.toEquipmentResponses(itemLedgerService.listEquipment(playerId)));
    }

    @PostMapping("/players/{playerId}/containers/place")
    public ResponseEntity<LedgerResponses.Slot> placeItem(
            @PathVariable Long playerId,
            @Valid @RequestBody LedgerRequests.PlaceItemRequest request
    ) {
        ContainerSlot slot = itemLedgerService.placeItem(
                playerId,
                request.container(),
                request.slotIndex(),
                request.itemId(),
                request.quantity()
        );
        return ResponseEntity.ok(responseMapper.toSlotResponse(slot));
    }

    @PostMapping("/players/{playerId}/containers/remove")
    public ResponseEntity<LedgerResponses.RemoveOutcome> removeItem(
            @PathVariable Long playerId,
            @Valid @RequestBody LedgerRequests.RemoveItemRequest request
    ) {
        ContainerSlot remaining = itemLedgerService.removeItem(
                playerId,
                request.container(),
                request.slotIndex(),
                request.quantity()
        );
        return ResponseEntity.ok(new LedgerResponses.RemoveOutcome(
                request.container(),
                request.slotIndex(),
                responseMapper.toSlotResponse(remaining)
        ));
    }

    @PostMapping("/players/{playerId}/equipment/equip")
    public ResponseEntity<LedgerResponses.EquipOutcome> equip(
            @PathVariable Long playerId,
            @Valid @RequestBody LedgerRequests.EquipRequest request
    ) {
        return ResponseEntity.ok(responseMapper.toEquipOutcomeResponse(
                itemLedgerService.equip(playerId, request.inventorySlot(), request.targetSlot())
        ));
    }

    @PostMapping("/players/{playerId}/equipment/unequip")
    public ResponseEntity<LedgerResponses.Slot> unequip(
            @PathVariable Long playerId,
            @Valid @RequestBody LedgerRequests.UnequipRequest request
    ) {
        return ResponseEntity.ok(responseMapper.toSlotResponse(itemLedgerService.unequip(playerId, request.slot())));
    }

    @PostMapping("/players/{playerId}/bank/deposit")
    public ResponseEntity<LedgerResponses.Slot> depositToBank(
            @PathVariable Long playerId,
            @Valid @RequestBody LedgerRequests.BankTransferRequest request
    ) {
        return ResponseEntity.ok(responseMapper.toSlotResponse(
                itemLedgerService.depositToBank(playerId, request.itemId(), request.quantity())
        ));
    }

    @PostMapping("/players/{playerId}/bank/withdraw")
    public ResponseEntity<LedgerResponses.Withdrawal> withdrawFromBank(
            @PathVariable Long playerId,
            @Valid @RequestBody LedgerRequests.BankTransferRequest request
    ) {
        List<ContainerSlot> slots = itemLedgerService.withdrawFromBank(playerId, request.itemId(), request.quantity());
        return ResponseEntity.ok(new LedgerResponses.Withdrawal(responseMapper.toSlotResponses(slots)));
    }

    @PostMapping("/players/{playerId}/coins/credit")
    public ResponseEntity<LedgerResponses.Coins> creditCoins(
            @PathVariable Long playerId,
            @Valid @RequestBody LedgerRequests.CoinAdjustmentRequest request
    ) {
        return ResponseEntity.ok(responseMapper.toCoinsResponse(itemLedgerService.creditCoins(playerId, request.amount())));
    }
}
