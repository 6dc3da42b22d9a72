package com.runeledger.service;

import com.runeledger.config.RuneLedgerProperties;
import com.runeledger.model.ContainerSlot;
import com.runeledger.model.ContainerType;
import com.runeledger.model.EquipmentSlotType;
import com.runeledger.model.ItemDefinition;
import com.runeledger.model.ItemRequirement;
import com.runeledger.model.ItemRequirementJsonCodec;
import com.runeledger.model.Player;
import com.runeledger.model.PlayerEquipment;
import com.runeledger.repository.ContainerSlotRepository;
import com.runeledger.repository.ItemDefinitionRepository;
import com.runeledger.repository.PlayerEquipmentRepository;
import com.runeledger.repository.PlayerRepository;
import com.runeledger.web.GameStateException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Inventory, bank, equipment and coin balance of a player. Every mutation holds the player row lock,
 * which serializes all ledger changes for that player.
 *
 * Bank slots stack every item. Inventory and equipment slots stack only stackable items.
 */
@Service
@RequiredArgsConstructor
public class ItemLedgerService {

    private static final Logger log = LoggerFactory.getLogger(ItemLedgerService.class);

    private final PlayerRepository playerRepository;
    private final ItemDefinitionRepository itemDefinitionRepository;
    private final ContainerSlotRepository containerSlotRepository;
    private final PlayerEquipmentRepository playerEquipmentRepository;
    private final RequirementEvaluator requirementEvaluator;
    private final RuneLedgerProperties runeLedgerProperties;
    private final TransactionRetryExecutor transactionRetryExecutor;

    public ContainerSlot placeItem(Long playerId, ContainerType container, int slotIndex, Integer itemId, int quantity) {
        return transactionRetryExecutor.execute("placeItem", () -> {
            lockPlayer(playerId);
            validateSlotIndex(container, slotIndex);
            validatePositiveQuantity(quantity);
            ItemDefinition item = requireItem(itemId);
            boolean stacks = stacksIn(container, item);
            if (!stacks && quantity > 1) {
                throw GameStateException.validation(
                        "NON_STACKABLE_QUANTITY",
                        item.getName() + " is not stackable; an inventory slot holds one"
                );
            }

            OffsetDateTime now = OffsetDateTime.now();
            ContainerSlot slot = containerSlotRepository
                    .findByPlayerIdAndContainerAndSlotIndex(playerId, container, slotIndex)
                    .orElse(null);
            if (slot == null) {
                return containerSlotRepository.save(newSlot(playerId, container, slotIndex, itemId, quantity, now));
            }
            if (!slot.getItemId().equals(itemId) || !stacks) {
                throw GameStateException.slotOccupied(
                        container + " slot " + slotIndex + " already holds item " + slot.getItemId()
                );
            }
            slot.setQuantity(addQuantity(slot.getQuantity(), quantity));
            slot.setUpdatedAt(now);
            return containerSlotRepository.save(slot);
        });
    }

    /**
     * @return the remaining slot contents, or {@code null} when the slot was emptied
     */
    public ContainerSlot removeItem(Long playerId, ContainerType container, int slotIndex, int quantity) {
        return transactionRetryExecutor.execute("removeItem", () -> {
            lockPlayer(playerId);
            validateSlotIndex(container, slotIndex);
            validatePositiveQuantity(quantity);

            ContainerSlot slot = containerSlotRepository
                    .findByPlayerIdAndContainerAndSlotIndex(playerId, container, slotIndex)
                    .orElse(null);
            int present = slot == null ? 0 : slot.getQuantity();
            if (quantity > present) {
                throw GameStateException.insufficientQuantity(
                        container + " slot " + slotIndex + " holds " + present + ", requested " + quantity
                );
            }
            return decrement(slot, quantity, OffsetDateTime.now());
        });
    }

    public EquipResult equip(Long playerId, int inventorySlot, EquipmentSlotType targetSlot) {
        return transactionRetryExecutor.execute("equip", () -> {
            lockPlayer(playerId);
            validateSlotIndex(ContainerType.INVENTORY, inventorySlot);

            ContainerSlot source = containerSlotRepository
                    .findByPlayerIdAndContainerAndSlotIndex(playerId, ContainerType.INVENTORY, inventorySlot)
                    .orElseThrow(() -> GameStateException.slotEmpty("Inventory slot " + inventorySlot + " is empty"));
            ItemDefinition item = requireItem(source.getItemId());
            if (!item.isEquipable() || item.getEquipmentSlot() == null) {
                throw GameStateException.itemNotEquipable(item.getName() + " cannot be equipped");
            }
            if (targetSlot != null && targetSlot != item.getEquipmentSlot()) {
                throw GameStateException.validation(
                        "WRONG_EQUIPMENT_SLOT",
                        item.getName() + " is worn in " + item.getEquipmentSlot() + ", not " + targetSlot
                );
            }
            List<ItemRequirement> unmet = requirementEvaluator.unmetRequirements(
                    playerId,
                    ItemRequirementJsonCodec.fromJson(item.getRequirementsJson())
            );
            if (!unmet.isEmpty()) {
                throw GameStateException.requirementsNotMet(
                        item.getName() + " requires " + RequirementEvaluator.describe(unmet)
                );
            }

            OffsetDateTime now = OffsetDateTime.now();
            EquipmentSlotType slotType = item.getEquipmentSlot();
            PlayerEquipment worn = playerEquipmentRepository.findByPlayerIdAndSlot(playerId, slotType).orElse(null);

            if (worn == null) {
                PlayerEquipment equipment = new PlayerEquipment();
                equipment.setPlayerId(playerId);
                equipment.setSlot(slotType);
                equipment.setItemId(item.getId());
                equipment.setQuantity(source.getQuantity());
                equipment.setUpdatedAt(now);
                containerSlotRepository.delete(source);
                return new EquipResult(playerEquipmentRepository.save(equipment), inventorySlot, null);
            }

            if (worn.getItemId().equals(item.getId()) && item.isStackable()) {
                worn.setQuantity(addQuantity(worn.getQuantity(), source.getQuantity()));
                worn.setUpdatedAt(now);
                containerSlotRepository.delete(source);
                return new EquipResult(playerEquipmentRepository.save(worn), inventorySlot, null);
            }

            // Swap in place so neither unique key is ever vacated and re-inserted.
            Integer previousItemId = worn.getItemId();
            int previousQuantity = worn.getQuantity();
            worn.setItemId(item.getId());
            worn.setQuantity(source.getQuantity());
            worn.setUpdatedAt(now);
            source.setItemId(previousItemId);
            source.setQuantity(previousQuantity);
            source.setUpdatedAt(now);
            containerSlotRepository.save(source);
            log.debug("Player {} swapped item {} out of {} for item {}", playerId, previousItemId, slotType, item.getId());
            return new EquipResult(playerEquipmentRepository.save(worn), inventorySlot, previousItemId);
        });
    }

    /**
     * Moves a worn item back to the inventory: onto an existing stack of the same stackable item,
     * else into the first free slot.
     */
    public ContainerSlot unequip(Long playerId, EquipmentSlotType slotType) {
        return transactionRetryExecutor.execute("unequip", () -> {
            lockPlayer(playerId);
            PlayerEquipment worn = playerEquipmentRepository.findByPlayerIdAndSlot(playerId, slotType)
                    .orElseThrow(() -> GameStateException.slotEmpty("Nothing is worn in " + slotType));
            ItemDefinition item = requireItem(worn.getItemId());
            OffsetDateTime now = OffsetDateTime.now();

            ContainerSlot target = null;
            if (item.isStackable()) {
                target = containerSlotRepository
                        .findByPlayerIdAndContainerAndItemIdOrderBySlotIndexAsc(playerId, ContainerType.INVENTORY, item.getId())
                        .stream()
                        .findFirst()
                        .orElse(null);
            }

            ContainerSlot result;
            if (target != null) {
                target.setQuantity(addQuantity(target.getQuantity(), worn.getQuantity()));
                target.setUpdatedAt(now);
                result = containerSlotRepository.save(target);
            } else {
                int freeSlot = firstFreeSlot(playerId, ContainerType.INVENTORY);
                if (freeSlot < 0) {
                    throw GameStateException.inventoryFull("No free inventory slot to unequip " + item.getName());
                }
                result = containerSlotRepository.save(
                        newSlot(playerId, ContainerType.INVENTORY, freeSlot, item.getId(), worn.getQuantity(), now)
                );
            }
            playerEquipmentRepository.delete(worn);
            return result;
        });
    }

    /**
     * Moves {@code quantity} units of an item from the inventory (lowest slots first) onto its bank stack.
     */
    public ContainerSlot depositToBank(Long playerId, Integer itemId, int quantity) {
        return transactionRetryExecutor.execute("depositToBank", () -> {
            lockPlayer(playerId);
            validatePositiveQuantity(quantity);
            requireItem(itemId);
            OffsetDateTime now = OffsetDateTime.now();

            List<ContainerSlot> carried = containerSlotRepository
                    .findByPlayerIdAndContainerAndItemIdOrderBySlotIndexAsc(playerId, ContainerType.INVENTORY, itemId);
            long available = carried.stream().mapToLong(ContainerSlot::getQuantity).sum();
            if (available < quantity) {
                throw GameStateException.insufficientQuantity(
                        "Inventory holds " + available + " of item " + itemId + ", requested " + quantity
                );
            }

            int outstanding = quantity;
            for (ContainerSlot slot : carried) {
                if (outstanding == 0) {
                    break;
                }
                int taken = Math.min(outstanding, slot.getQuantity());
                decrement(slot, taken, now);
                outstanding -= taken;
            }
            return addToBank(playerId, itemId, quantity);
        });
    }

    /**
     * Moves {@code quantity} units from the bank into the inventory. Non-stackable items need one free
     * inventory slot per unit.
     */
    public List<ContainerSlot> withdrawFromBank(Long playerId, Integer itemId, int quantity) {
        return transactionRetryExecutor.execute("withdrawFromBank", () -> {
            lockPlayer(playerId);
            validatePositiveQuantity(quantity);
            ItemDefinition item = requireItem(itemId);
            OffsetDateTime now = OffsetDateTime.now();

            takeFromBank(playerId, itemId, quantity);

            if (item.isStackable()) {
                ContainerSlot stack = containerSlotRepository
                        .findByPlayerIdAndContainerAndItemIdOrderBySlotIndexAsc(playerId, ContainerType.INVENTORY, itemId)
                        .stream()
                        .findFirst()
                        .orElse(null);
                if (stack != null) {
                    stack.setQuantity(addQuantity(stack.getQuantity(), quantity));
                    stack.setUpdatedAt(now);
                    return List.of(containerSlotRepository.save(stack));
                }
                int freeSlot = firstFreeSlot(playerId, ContainerType.INVENTORY);
                if (freeSlot < 0) {
                    throw GameStateException.inventoryFull("No free inventory slot for " + item.getName());
                }
                return List.of(containerSlotRepository.save(
                        newSlot(playerId, ContainerType.INVENTORY, freeSlot, itemId, quantity, now)
                ));
            }

            List<Integer> freeSlots = freeSlots(playerId, ContainerType.INVENTORY, quantity);
            if (freeSlots.size() < quantity) {
                throw GameStateException.inventoryFull(
                        "Withdrawing " + quantity + " x " + item.getName() + " needs " + quantity
                                + " free inventory slots, " + freeSlots.size() + " available"
                );
            }
            return freeSlots.stream()
                    .map(index -> containerSlotRepository.save(
                            newSlot(playerId, ContainerType.INVENTORY, index, itemId, 1, now)
                    ))
                    .toList();
        });
    }

    /**
     * Adds items to the player's bank stack for the item, opening the first free bank slot when needed.
     */
    public ContainerSlot addToBank(Long playerId, Integer itemId, int quantity) {
        return transactionRetryExecutor.execute("addToBank", () -> {
            lockPlayer(playerId);
            validatePositiveQuantity(quantity);
            OffsetDateTime now = OffsetDateTime.now();
            ContainerSlot stack = containerSlotRepository
                    .findByPlayerIdAndContainerAndItemIdOrderBySlotIndexAsc(playerId, ContainerType.BANK, itemId)
                    .stream()
                    .findFirst()
                    .orElse(null);
            if (stack != null) {
                stack.setQuantity(addQuantity(stack.getQuantity(), quantity));
                stack.setUpdatedAt(now);
                return containerSlotRepository.save(stack);
            }
            int freeSlot = firstFreeSlot(playerId, ContainerType.BANK);
            if (freeSlot < 0) {
                throw GameStateException.bankFull("Bank of player " + playerId + " has no free slot");
            }
            return containerSlotRepository.save(newSlot(playerId, ContainerType.BANK, freeSlot, itemId, quantity, now));
        });
    }

    /**
     * Whether {@link #addToBank} would reject the item: no bank stack of it and no free bank slot.
     */
    public boolean isBankFullFor(Long playerId, Integer itemId) {
        return transactionRetryExecutor.execute("isBankFullFor", () -> {
            lockPlayer(playerId);
            boolean stacked = !containerSlotRepository
                    .findByPlayerIdAndContainerAndItemIdOrderBySlotIndexAsc(playerId, ContainerType.BANK, itemId)
                    .isEmpty();
            return !stacked && firstFreeSlot(playerId, ContainerType.BANK) < 0;
        });
    }

    /**
     * Removes items from the player's bank across the stacks holding the item.
     */
    public void takeFromBank(Long playerId, Integer itemId, int quantity) {
        transactionRetryExecutor.run("takeFromBank", () -> {
            lockPlayer(playerId);
            validatePositiveQuantity(quantity);
            List<ContainerSlot> stacks = containerSlotRepository
                    .findByPlayerIdAndContainerAndItemIdOrderBySlotIndexAsc(playerId, ContainerType.BANK, itemId);
            long available = stacks.stream().mapToLong(ContainerSlot::getQuantity).sum();
            if (available < quantity) {
                throw GameStateException.insufficientQuantity(
                        "Bank holds " + available + " of item " + itemId + ", requested " + quantity
                );
            }
            OffsetDateTime now = OffsetDateTime.now();
            int outstanding = quantity;
            for (ContainerSlot stack : stacks) {
                if (outstanding == 0) {
                    break;
                }
                int taken = Math.min(outstanding, stack.getQuantity());
                decrement(stack, taken, now);
                outstanding -= taken;
            }
        });
    }

    public Player creditCoins(Long playerId, long amount) {
        if (amount <= 0) {
            throw GameStateException.validation("INVALID_AMOUNT", "amount must be positive");
        }
        return transactionRetryExecutor.execute("creditCoins", () -> {
            Player player = lockPlayer(playerId);
            try {
                player.setCoins(Math.addExact(player.getCoins(), amount));
            } catch (ArithmeticException e) {
                throw GameStateException.validation("COIN_OVERFLOW", "Coin balance of player " + playerId + " would overflow");
            }
            player.setUpdatedAt(OffsetDateTime.now());
            return playerRepository.save(player);
        });
    }

    public Player debitCoins(Long playerId, long amount) {
        if (amount <= 0) {
            throw GameStateException.validation("INVALID_AMOUNT", "amount must be positive");
        }
        return transactionRetryExecutor.execute("debitCoins", () -> {
            Player player = lockPlayer(playerId);
            if (player.getCoins() < amount) {
                throw GameStateException.insufficientCoins(
                        "Player " + playerId + " holds " + player.getCoins() + " coins, needs " + amount
                );
            }
            player.setCoins(player.getCoins() - amount);
            player.setUpdatedAt(OffsetDateTime.now());
            return playerRepository.save(player);
        });
    }

    @Transactional(readOnly = true)
    public List<ItemDefinition> listItems() {
        return itemDefinitionRepository.findAllByOrderByIdAsc();
    }

    @Transactional(readOnly = true)
    public ItemDefinition getItem(Integer itemId) {
        return requireItem(itemId);
    }

    @Transactional(readOnly = true)
    public List<ContainerSlot> listContainer(Long playerId, ContainerType container) {
        return containerSlotRepository.findByPlayerIdAndContainerOrderBySlotIndexAsc(playerId, container);
    }

    @Transactional(readOnly = true)
    public List<PlayerEquipment> listEquipment(Long playerId) {
        return playerEquipmentRepository.findByPlayerIdOrderByIdAsc(playerId);
    }

    private Player lockPlayer(Long playerId) {
        return playerRepository.findByIdForUpdate(playerId)
                .orElseThrow(() -> GameStateException.playerNotFound(playerId));
    }

    private ItemDefinition requireItem(Integer itemId) {
        if (itemId == null) {
            throw GameStateException.validation("ITEM_REQUIRED", "itemId is required");
        }
        return itemDefinitionRepository.findById(itemId)
                .orElseThrow(() -> GameStateException.itemNotFound(itemId));
    }

    private ContainerSlot decrement(ContainerSlot slot, int quantity, OffsetDateTime now) {
        int remaining = slot.getQuantity() - quantity;
        if (remaining == 0) {
            containerSlotRepository.delete(slot);
            containerSlotRepository.flush();
            return null;
        }
        slot.setQuantity(remaining);
        slot.setUpdatedAt(now);
        return containerSlotRepository.save(slot);
    }

    private int firstFreeSlot(Long playerId, ContainerType container) {
        List<Integer> free = freeSlots(playerId, container, 1);
        return free.isEmpty() ? -1 : free.get(0);
    }

    private List<Integer> freeSlots(Long playerId, ContainerType container, int wanted) {
        Set<Integer> used = new HashSet<>();
        for (ContainerSlot slot : containerSlotRepository.findByPlayerIdAndContainerOrderBySlotIndexAsc(playerId, container)) {
            used.add(slot.getSlotIndex());
        }
        int capacity = capacityOf(container);
        List<Integer> free = new ArrayList<>();
        for (int index = 0; index < capacity && free.size() < wanted; index++) {
            if (!used.contains(index)) {
                free.add(index);
            }
        }
        return free;
    }

    private int capacityOf(ContainerType container) {
        RuneLedgerProperties.Ledger ledger = runeLedgerProperties.getLedger();
        return container == ContainerType.BANK ? ledger.getBankSize() : ledger.getInventorySize();
    }

    private void validateSlotIndex(ContainerType container, int slotIndex) {
        if (container == null) {
            throw GameStateException.validation("CONTAINER_REQUIRED", "container is required");
        }
        int capacity = capacityOf(container);
        if (slotIndex < 0 || slotIndex >= capacity) {
            throw GameStateException.validation(
                    "INVALID_SLOT",
                    container + " slot must be between 0 and " + (capacity - 1)
            );
        }
    }

    private static boolean stacksIn(ContainerType container, ItemDefinition item) {
        return container == ContainerType.BANK || item.isStackable();
    }

    private static void validatePositiveQuantity(int quantity) {
        if (quantity <= 0) {
            throw GameStateException.validation("INVALID_QUANTITY", "quantity must be positive");
        }
    }

    private static int addQuantity(int current, int added) {
        try {
            return Math.addExact(current, added);
        } catch (ArithmeticException e) {
            throw GameStateException.validation("QUANTITY_OVERFLOW", "stack size would exceed " + Integer.MAX_VALUE);
        }
    }

    private static ContainerSlot newSlot(
            Long playerId,
            ContainerType container,
            int slotIndex,
            Integer itemId,
            int quantity,
            OffsetDateTime now
    ) {
        ContainerSlot slot = new ContainerSlot();
        slot.setPlayerId(playerId);
        slot.setContainer(container);
        slot.setSlotIndex(slotIndex);
        slot.setItemId(itemId);
        slot.setQuantity(quantity);
        slot.setUpdatedAt(now);
        return slot;
    }
}
