package com.runeledger.controller;

import com.runeledger.mapper.GameStateResponseMapper;
import com.runeledger.model.ContainerSlot;
import com.runeledger.model.ContainerType;
import com.runeledger.model.EquipmentSlotType;
import com.runeledger.model.Player;
import com.runeledger.model.PlayerEquipment;
import com.runeledger.service.EquipResult;
import com.runeledger.service.ItemLedgerService;
import com.runeledger.web.GameStateException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(LedgerController.class)
@Import(GameStateResponseMapper.class)
class LedgerControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ItemLedgerService itemLedgerService;

    @Test
    void placeItemReturnsResultingSlot() throws Exception {
        when(itemLedgerService.placeItem(7L, ContainerType.INVENTORY, 3, 5, 250))
                .thenReturn(slot(7L, ContainerType.INVENTORY, 3, 5, 250));

        mockMvc.perform(post("/api/players/{playerId}/containers/place", 7L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"container": "INVENTORY", "slotIndex": 3, "itemId": 5, "quantity": 250}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.slotIndex").value(3))
                .andExpect(jsonPath("$.quantity").value(250));
    }

    @Test
    void removeWholeStackReturnsEmptySlot() throws Exception {
        when(itemLedgerService.removeItem(7L, ContainerType.INVENTORY, 3, 250)).thenReturn(null);

        mockMvc.perform(post("/api/players/{playerId}/containers/remove", 7L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"container": "INVENTORY", "slotIndex": 3, "quantity": 250}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.container").value("INVENTORY"))
                .andExpect(jsonPath("$.slotIndex").value(3))
                .andExpect(jsonPath("$.slot").isEmpty());
    }

    @Test
    void equipReportsSwappedOutItem() throws Exception {
        PlayerEquipment worn = new PlayerEquipment();
        worn.setPlayerId(7L);
        worn.setSlot(EquipmentSlotType.WEAPON);
        worn.setItemId(2);
        when(itemLedgerService.equip(7L, 4, null)).thenReturn(new EquipResult(worn, 4, 1));

        mockMvc.perform(post("/api/players/{playerId}/equipment/equip", 7L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"inventorySlot\": 4}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.equipment.slot").value("WEAPON"))
                .andExpect(jsonPath("$.equipment.itemId").value(2))
                .andExpect(jsonPath("$.swappedOutItemId").value(1));
    }

    @Test
    void withdrawWithoutInventoryRoomReturnsUnprocessable() throws Exception {
        when(itemLedgerService.withdrawFromBank(7L, 8, 5))
                .thenThrow(GameStateException.inventoryFull("Withdrawing 5 x Logs needs 5 free inventory slots"));

        mockMvc.perform(post("/api/players/{playerId}/bank/withdraw", 7L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"itemId\": 8, \"quantity\": 5}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("INVENTORY_FULL"))
                .andExpect(jsonPath("$.category").value("INSUFFICIENT_RESOURCE"));
    }

    @Test
    void withdrawListsEveryFilledSlot() throws Exception {
        when(itemLedgerService.withdrawFromBank(7L, 8, 2)).thenReturn(List.of(
                slot(7L, ContainerType.INVENTORY, 0, 8, 1),
                slot(7L, ContainerType.INVENTORY, 1, 8, 1)
        ));

        mockMvc.perform(post("/api/players/{playerId}/bank/withdraw", 7L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"itemId\": 8, \"quantity\": 2}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.inventorySlots.length()").value(2))
                .andExpect(jsonPath("$.inventorySlots[1].slotIndex").value(1));
    }

    @Test
    void creditNonPositiveAmountReturnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/players/{playerId}/coins/credit", 7L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": 0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors.amount").value("amount must be positive"));

        verify(itemLedgerService, never()).creditCoins(anyLong(), anyLong());
    }

    @Test
    void creditReturnsNewBalance() throws Exception {
        Player player = new Player();
        player.setId(7L);
        player.setCoins(5_000L);
        when(itemLedgerService.creditCoins(7L, 5_000L)).thenReturn(player);

        mockMvc.perform(post("/api/players/{playerId}/coins/credit", 7L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": 5000}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.playerId").value(7))
                .andExpect(jsonPath("$.coins").value(5000));
    }

    @Test
    void getUnknownItemReturnsNotFound() throws Exception {
        when(itemLedgerService.getItem(9999)).thenThrow(GameStateException.itemNotFound(9999));

        mockMvc.perform(get("/api/items/{itemId}", 9999))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("ITEM_NOT_FOUND"));
    }

    private static ContainerSlot slot(Long playerId, ContainerType container, int index, Integer itemId, int quantity) {
        ContainerSlot slot = new ContainerSlot();
        slot.setPlayerId(playerId);
        slot.setContainer(container);
        slot.setSlotIndex(index);
        slot.setItemId(itemId);
        slot.setQuantity(quantity);
        return slot;
    }
}
