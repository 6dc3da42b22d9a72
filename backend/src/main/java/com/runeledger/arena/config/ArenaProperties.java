package com.runeledger.arena.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Battle rating constants, the inactivity maintenance worker and tournament defaults.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "runeledger.arena")
public class ArenaProperties {

    private Rating rating = new Rating();
    private Maintenance maintenance = new Maintenance();
    private Tournament tournament = new Tournament();

    @Getter
    @Setter
    public static class Rating {
        private double initialRating = 1000.0;
        private double initialUncertainty = 350.0;
        private double minUncertainty = 50.0;
        private double maxUncertainty = 350.0;

        /**
         * Multiplier applied to uncertainty after every battle, floored at {@code minUncertainty}.
         */
        private double uncertaintyDecayFactor = 0.95;

        private double baseKFactor = 32.0;
        private double minKFactor = 4.0;

        /**
         * Idle days after the last battle before uncertainty starts growing again.
         */
        private int inactivityThresholdDays = 7;

        /**
         * The c in sqrt(u^2 + c^2 * idleDays).
         */
        private double inactivityGrowthPerDay = 15.0;
    }

    @Getter
    @Setter
    public static class Maintenance {
        private boolean enabled = false;
        private long initialDelayMs = 60000;
        private long pollIntervalMs = 3600000;
        private int batchSize = 200;
    }

    @Getter
    @Setter
    public static class Tournament {
        private int minParticipants = 2;
        private int defaultMaxParticipants = 64;
    }
}
