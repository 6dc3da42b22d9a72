package com.runeledger.service;

import com.runeledger.model.Player;
import com.runeledger.repository.PlayerRepository;
import com.runeledger.web.GameStateException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.function.ToIntFunction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PlayerPurgeServiceTest {

    private static final Long PLAYER_ID = 11L;

    @Mock
    private PlayerRepository playerRepository;

    @Mock
    private TransactionRetryExecutor transactionRetryExecutor;

    private final List<String> purgeCalls = new ArrayList<>();

    private PlayerPurgeService playerPurgeService;

    @BeforeEach
    void setUp() {
        List<PlayerOwnedStore> stores = List.of(
                new RepositoryPlayerOwnedStore("player_quests", 30, recording("player_quests", 4)),
                new RepositoryPlayerOwnedStore("container_slots", 10, recording("container_slots", 28)),
                new RepositoryPlayerOwnedStore("player_skills", 20, recording("player_skills", 23))
        );
        playerPurgeService = new PlayerPurgeService(playerRepository, stores, transactionRetryExecutor);
        when(transactionRetryExecutor.execute(anyString(), ArgumentMatchers.<Supplier<PlayerPurgeReport>>any()))
                .thenAnswer(invocation -> invocation.<Supplier<PlayerPurgeReport>>getArgument(1).get());
    }

    @Test
    void purgePlayer_deletesStoresInOrderThenPlayerRow() {
        Player player = new Player();
        player.setId(PLAYER_ID);
        when(playerRepository.findByIdForUpdate(PLAYER_ID)).thenReturn(Optional.of(player));
        when(playerRepository.deletePlayerById(PLAYER_ID)).thenReturn(1);

        PlayerPurgeReport report = playerPurgeService.purgePlayer(PLAYER_ID);

        assertEquals(List.of("container_slots", "player_skills", "player_quests"), purgeCalls);
        assertEquals(4, report.deletions().size());
        assertEquals("players", report.deletions().get(3).storeName());
        assertEquals(56, report.totalRowsDeleted());
    }

    @Test
    void purgePlayer_unknownPlayer_deletesNothing() {
        when(playerRepository.findByIdForUpdate(PLAYER_ID)).thenReturn(Optional.empty());

        GameStateException ex = assertThrows(GameStateException.class, () -> playerPurgeService.purgePlayer(PLAYER_ID));

        assertEquals("PLAYER_NOT_FOUND", ex.getCode());
        assertTrue(purgeCalls.isEmpty());
        verify(playerRepository, never()).deletePlayerById(PLAYER_ID);
    }

    private ToIntFunction<Long> recording(String store, int rows) {
        return playerId -> {
            purgeCalls.add(store);
            return rows;
        };
    }
}
