package com.runeledger.arena.service;

import com.runeledger.arena.config.ArenaProperties;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;

@Service
@RequiredArgsConstructor
public class RatingMaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(RatingMaintenanceScheduler.class);

    private final ArenaProperties arenaProperties;
    private final RatingMaintenanceService ratingMaintenanceService;

    @Scheduled(
            fixedRateString = "${runeledger.arena.maintenance.poll-interval-ms:3600000}",
            initialDelayString = "${runeledger.arena.maintenance.initial-delay-ms:60000}"
    )
    public void runMaintenanceTick() {
        if (!arenaProperties.getMaintenance().isEnabled()) {
            return;
        }

        RatingMaintenanceService.DecaySummary summary =
                ratingMaintenanceService.applyInactivityDecay(OffsetDateTime.now());
        if (summary.hasWork()) {
            log.info(
                    "Rating maintenance tick: ratingsScanned={}, ratingsUpdated={}",
                    summary.ratingsScanned(),
                    summary.ratingsUpdated()
            );
        } else {
            log.debug("Rating maintenance tick completed with no state changes");
        }
    }
}
