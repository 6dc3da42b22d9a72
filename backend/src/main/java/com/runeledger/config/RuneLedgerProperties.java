package com.runeledger.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Core engine settings: transaction retry policy, container sizes and exchange limits.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "runeledger")
public class RuneLedgerProperties {

    private Transaction transaction = new Transaction();
    private Ledger ledger = new Ledger();
    private Exchange exchange = new Exchange();

    @Getter
    @Setter
    public static class Transaction {
        /**
         * Attempts per mutating operation before a concurrency conflict is surfaced.
         */
        private int maxAttempts = 3;

        /**
         * Linear backoff between attempts (attempt number times this value).
         */
        private long retryBackoffMs = 25;

        /**
         * Applied to every pooled connection as the PostgreSQL lock_timeout.
         */
        private long lockTimeoutMs = 3000;
    }

    @Getter
    @Setter
    public static class Ledger {
        private int inventorySize = 28;
        private int bankSize = 800;
    }

    @Getter
    @Setter
    public static class Exchange {
        private int maxOrderQuantity = Integer.MAX_VALUE;
        private long maxPricePerUnit = Integer.MAX_VALUE;
        private int buyLimitWindowHours = 4;

        /**
         * When false a player's own resting orders are skipped during matching.
         */
        private boolean allowSelfMatch = false;

        private int priceHistoryDefaultDays = 30;
    }
}
