package com.runeledger.web;

import lombok.Getter;

@Getter
public class GameStateException extends RuntimeException {

    private final ErrorCategory category;
    private final String code;

    public GameStateException(ErrorCategory category, String code, String message) {
        super(message);
        this.category = category;
        this.code = code;
    }

    public GameStateException(ErrorCategory category, String code, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
        this.code = code;
    }

    public static GameStateException validation(String code, String detail) {
        return new GameStateException(ErrorCategory.VALIDATION, code, detail);
    }

    public static GameStateException notFound(String code, String detail) {
        return new GameStateException(ErrorCategory.NOT_FOUND, code, detail);
    }

    public static GameStateException playerNotFound(Long playerId) {
        return notFound("PLAYER_NOT_FOUND", "Player not found: " + playerId);
    }

    public static GameStateException itemNotFound(Integer itemId) {
        return notFound("ITEM_NOT_FOUND", "Item not found: " + itemId);
    }

    public static GameStateException slotOccupied(String detail) {
        return new GameStateException(ErrorCategory.CONSTRAINT_VIOLATION, "SLOT_OCCUPIED", detail);
    }

    public static GameStateException slotEmpty(String detail) {
        return new GameStateException(ErrorCategory.CONSTRAINT_VIOLATION, "SLOT_EMPTY", detail);
    }

    public static GameStateException itemNotEquipable(String detail) {
        return new GameStateException(ErrorCategory.CONSTRAINT_VIOLATION, "ITEM_NOT_EQUIPABLE", detail);
    }

    public static GameStateException requirementsNotMet(String detail) {
        return new GameStateException(ErrorCategory.CONSTRAINT_VIOLATION, "REQUIREMENTS_NOT_MET", detail);
    }

    public static GameStateException itemNotTradeable(String detail) {
        return new GameStateException(ErrorCategory.CONSTRAINT_VIOLATION, "ITEM_NOT_TRADEABLE", detail);
    }

    public static GameStateException buyLimitExceeded(String detail) {
        return new GameStateException(ErrorCategory.CONSTRAINT_VIOLATION, "BUY_LIMIT_EXCEEDED", detail);
    }

    public static GameStateException orderNotCancellable(String detail) {
        return new GameStateException(ErrorCategory.CONSTRAINT_VIOLATION, "ORDER_NOT_CANCELLABLE", detail);
    }

    public static GameStateException orderNotOwned(String detail) {
        return new GameStateException(ErrorCategory.CONSTRAINT_VIOLATION, "ORDER_NOT_OWNED", detail);
    }

    public static GameStateException playerNotActive(String detail) {
        return new GameStateException(ErrorCategory.CONSTRAINT_VIOLATION, "PLAYER_NOT_ACTIVE", detail);
    }

    public static GameStateException tournamentConflict(String code, String detail) {
        return new GameStateException(ErrorCategory.CONSTRAINT_VIOLATION, code, detail);
    }

    public static GameStateException battleKeyConflict(String detail) {
        return new GameStateException(ErrorCategory.CONSTRAINT_VIOLATION, "BATTLE_KEY_CONFLICT", detail);
    }

    public static GameStateException dropKeyConflict(String detail) {
        return new GameStateException(ErrorCategory.CONSTRAINT_VIOLATION, "DROP_KEY_CONFLICT", detail);
    }

    public static GameStateException insufficientQuantity(String detail) {
        return new GameStateException(ErrorCategory.INSUFFICIENT_RESOURCE, "INSUFFICIENT_QUANTITY", detail);
    }

    public static GameStateException insufficientCoins(String detail) {
        return new GameStateException(ErrorCategory.INSUFFICIENT_RESOURCE, "INSUFFICIENT_COINS", detail);
    }

    public static GameStateException inventoryFull(String detail) {
        return new GameStateException(ErrorCategory.INSUFFICIENT_RESOURCE, "INVENTORY_FULL", detail);
    }

    public static GameStateException bankFull(String detail) {
        return new GameStateException(ErrorCategory.INSUFFICIENT_RESOURCE, "BANK_FULL", detail);
    }

    public static GameStateException experienceRegression(String detail) {
        return new GameStateException(ErrorCategory.INVARIANT_VIOLATION, "EXPERIENCE_REGRESSION", detail);
    }

    public static GameStateException overFill(String detail) {
        return new GameStateException(ErrorCategory.INVARIANT_VIOLATION, "OVER_FILL", detail);
    }

    public static GameStateException invariantViolation(String code, String detail) {
        return new GameStateException(ErrorCategory.INVARIANT_VIOLATION, code, detail);
    }

    public static GameStateException concurrencyConflict(String detail, Throwable cause) {
        return new GameStateException(ErrorCategory.CONCURRENCY_CONFLICT, "CONCURRENCY_CONFLICT", detail, cause);
    }
}
