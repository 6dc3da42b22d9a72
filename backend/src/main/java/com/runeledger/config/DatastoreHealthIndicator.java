package com.runeledger.config;

import com.runeledger.model.OrderStatus;
import com.runeledger.repository.ExchangeOrderRepository;
import com.runeledger.repository.PlayerRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
public class DatastoreHealthIndicator implements HealthIndicator {

    private final PlayerRepository playerRepository;
    private final ExchangeOrderRepository exchangeOrderRepository;

    public DatastoreHealthIndicator(PlayerRepository playerRepository, ExchangeOrderRepository exchangeOrderRepository) {
        this.playerRepository = playerRepository;
        this.exchangeOrderRepository = exchangeOrderRepository;
    }

    @Override
    public Health health() {
        try {
            long players = playerRepository.count();
            long activeOrders = exchangeOrderRepository.countByStatus(OrderStatus.ACTIVE);
            return Health.up()
                    .withDetail("players", players)
                    .withDetail("activeOrders", activeOrders)
                    .build();
        } catch (Exception e) {
            return Health.down()
                    .withException(e)
                    .build();
        }
    }
}
