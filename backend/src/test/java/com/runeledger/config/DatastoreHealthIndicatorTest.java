package com.runeledger.config;

import com.runeledger.model.OrderStatus;
import com.runeledger.repository.ExchangeOrderRepository;
import com.runeledger.repository.PlayerRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.dao.DataAccessResourceFailureException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DatastoreHealthIndicatorTest {

    @Mock
    private PlayerRepository playerRepository;

    @Mock
    private ExchangeOrderRepository exchangeOrderRepository;

    @InjectMocks
    private DatastoreHealthIndicator datastoreHealthIndicator;

    @Test
    void reportsUpWithCounts() {
        when(playerRepository.count()).thenReturn(12L);
        when(exchangeOrderRepository.countByStatus(OrderStatus.ACTIVE)).thenReturn(4L);

        Health health = datastoreHealthIndicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals(12L, health.getDetails().get("players"));
        assertEquals(4L, health.getDetails().get("activeOrders"));
    }

    @Test
    void reportsDownWhenDatastoreIsUnreachable() {
        when(playerRepository.count()).thenThrow(new DataAccessResourceFailureException("connection refused"));

        Health health = datastoreHealthIndicator.health();

        assertEquals(Status.DOWN, health.getStatus());
    }
}
