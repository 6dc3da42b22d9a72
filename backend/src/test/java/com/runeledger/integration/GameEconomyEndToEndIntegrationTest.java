package com.runeledger.integration;

import com.runeledger.arena.model.BattleOutcome;
import com.runeledger.arena.model.BattleRating;
import com.runeledger.arena.model.Tournament;
import com.runeledger.arena.model.TournamentMatch;
import com.runeledger.arena.model.TournamentMatchStatus;
import com.runeledger.arena.model.TournamentParticipant;
import com.runeledger.arena.model.TournamentStatus;
import com.runeledger.arena.repository.BattleRatingRepository;
import com.runeledger.arena.service.BattleRatingService;
import com.runeledger.arena.service.BattleResult;
import com.runeledger.arena.service.RatingMaintenanceService;
import com.runeledger.arena.service.RecordBattleCommand;
import com.runeledger.arena.service.TournamentBracket;
import com.runeledger.arena.service.TournamentService;
import com.runeledger.model.BattleCategory;
import com.runeledger.model.ContainerSlot;
import com.runeledger.model.ContainerType;
import com.runeledger.model.ExchangeOrder;
import com.runeledger.model.GameMode;
import com.runeledger.model.OrderSide;
import com.runeledger.model.OrderStatus;
import com.runeledger.model.Player;
import com.runeledger.repository.ContainerSlotRepository;
import com.runeledger.repository.ExchangeOrderRepository;
import com.runeledger.repository.PlayerRepository;
import com.runeledger.service.CollectionLogResult;
import com.runeledger.service.CollectionLogService;
import com.runeledger.service.ExchangeService;
import com.runeledger.service.ItemLedgerService;
import com.runeledger.service.OrderBookDepth;
import com.runeledger.service.OrderSubmissionResult;
import com.runeledger.service.PlayerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE, properties = {
        "spring.jpa.hibernate.ddl-auto=validate",
        "spring.flyway.enabled=true",
        "spring.flyway.locations=classpath:db/migration",
        "runeledger.arena.maintenance.enabled=false"
})
@Testcontainers(disabledWithoutDocker = true)
class GameEconomyEndToEndIntegrationTest {

    private static final int LOGS = 8;
    private static final AtomicLong ACCOUNT_IDS = new AtomicLong(50_000L);

    @Container
    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("runeledger")
            .withUsername("runeledger")
            .withPassword("changeme");

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
    }

    @Autowired
    private PlayerService playerService;

    @Autowired
    private ItemLedgerService itemLedgerService;

    @Autowired
    private ExchangeService exchangeService;

    @Autowired
    private TournamentService tournamentService;

    @Autowired
    private CollectionLogService collectionLogService;

    @Autowired
    private RatingMaintenanceService ratingMaintenanceService;

    @Autowired
    private BattleRatingService battleRatingService;

    @Autowired
    private PlayerRepository playerRepository;

    @Autowired
    private ContainerSlotRepository containerSlotRepository;

    @Autowired
    private ExchangeOrderRepository exchangeOrderRepository;

    @Autowired
    private BattleRatingRepository battleRatingRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void isolateGameData() {
        jdbcTemplate.execute("""
                TRUNCATE TABLE
                    tournament_matches,
                    tournament_participants,
                    tournaments,
                    battle_ratings,
                    battle_records,
                    exchange_trades,
                    exchange_orders,
                    exchange_item_books,
                    collection_log_drops,
                    collection_log_entries,
                    player_achievements,
                    player_quests,
                    player_equipment,
                    player_container_slots,
                    player_skills,
                    players
                RESTART IDENTITY CASCADE
                """);
    }

    @Test
    void migrationsApplyAndSeedCatalog() {
        Integer applied = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM flyway_schema_history WHERE success = TRUE",
                Integer.class
        );
        Integer items = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM items", Integer.class);

        assertEquals(5, applied);
        assertNotNull(items);
        assertTrue(items > 0);
    }

    @Test
    void registeredPlayerStartsAtBaseline() {
        Player player = register("Zezima");

        assertEquals(32, player.getTotalLevel());
        assertEquals(3, player.getCombatLevel());
        assertEquals(0L, player.getCoins());
    }

    @Test
    void buyOrderSweepsOlderSellFirstAndRefundsPriceImprovement() {
        Player firstSeller = register("Seller One");
        Player secondSeller = register("Seller Two");
        Player buyer = register("Buyer");

        itemLedgerService.addToBank(firstSeller.getId(), LOGS, 10);
        itemLedgerService.addToBank(secondSeller.getId(), LOGS, 5);
        itemLedgerService.creditCoins(buyer.getId(), 2_000L);

        OrderSubmissionResult firstSell = exchangeService.submitOrder(firstSeller.getId(), LOGS, OrderSide.SELL, 10, 100L);
        OrderSubmissionResult secondSell = exchangeService.submitOrder(secondSeller.getId(), LOGS, OrderSide.SELL, 5, 100L);
        assertTrue(firstSell.trades().isEmpty());
        assertTrue(secondSell.trades().isEmpty());

        OrderSubmissionResult buy = exchangeService.submitOrder(buyer.getId(), LOGS, OrderSide.BUY, 12, 110L);

        assertEquals(2, buy.trades().size());
        assertEquals(10, buy.trades().get(0).getQuantity());
        assertEquals(firstSeller.getId(), buy.trades().get(0).getSellerId());
        assertEquals(2, buy.trades().get(1).getQuantity());
        assertEquals(secondSeller.getId(), buy.trades().get(1).getSellerId());
        assertEquals(120L, buy.coinsRefunded());
        assertEquals(OrderStatus.COMPLETED, buy.order().getStatus());

        assertEquals(800L, playerRepository.findById(buyer.getId()).orElseThrow().getCoins());
        assertEquals(1_000L, playerRepository.findById(firstSeller.getId()).orElseThrow().getCoins());
        assertEquals(200L, playerRepository.findById(secondSeller.getId()).orElseThrow().getCoins());
        assertEquals(12, bankQuantity(buyer.getId(), LOGS));
        assertEquals(0, bankQuantity(firstSeller.getId(), LOGS));

        ExchangeOrder secondSellOrder = exchangeOrderRepository.findById(secondSell.order().getId()).orElseThrow();
        assertEquals(OrderStatus.ACTIVE, secondSellOrder.getStatus());
        assertEquals(3, secondSellOrder.remainingQuantity());

        OrderBookDepth depth = exchangeService.getDepth(LOGS);
        assertEquals(100L, depth.lastTradePrice());
        assertEquals(12L, depth.dailyVolume());
        assertTrue(depth.bids().isEmpty());
        assertEquals(1, depth.asks().size());
        assertEquals(3L, depth.asks().get(0).quantity());

        exchangeService.cancelOrder(secondSeller.getId(), secondSellOrder.getId());
        assertEquals(3, bankQuantity(secondSeller.getId(), LOGS));
    }

    @Test
    void concurrentBuyersNeverOverfillOneRestingSell() throws Exception {
        Player seller = register("Merchant");
        itemLedgerService.addToBank(seller.getId(), LOGS, 10);
        OrderSubmissionResult sell = exchangeService.submitOrder(seller.getId(), LOGS, OrderSide.SELL, 10, 50L);

        List<Player> buyers = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            Player buyer = register("Racer " + i);
            itemLedgerService.creditCoins(buyer.getId(), 1_000L);
            buyers.add(buyer);
        }

        ExecutorService pool = Executors.newFixedThreadPool(buyers.size());
        CountDownLatch start = new CountDownLatch(1);
        List<Future<OrderSubmissionResult>> results = new ArrayList<>();
        try {
            for (Player buyer : buyers) {
                results.add(pool.submit(() -> {
                    start.await();
                    return exchangeService.submitOrder(buyer.getId(), LOGS, OrderSide.BUY, 4, 50L);
                }));
            }
            start.countDown();

            int traded = 0;
            for (Future<OrderSubmissionResult> result : results) {
                traded += result.get(30, TimeUnit.SECONDS).trades().stream()
                        .mapToInt(trade -> trade.getQuantity())
                        .sum();
            }
            assertEquals(10, traded);
        } finally {
            pool.shutdownNow();
        }

        ExchangeOrder restingSell = exchangeOrderRepository.findById(sell.order().getId()).orElseThrow();
        assertEquals(10, restingSell.getQuantityFilled());
        assertEquals(OrderStatus.COMPLETED, restingSell.getStatus());
        assertEquals(500L, playerRepository.findById(seller.getId()).orElseThrow().getCoins());

        int bought = buyers.stream().mapToInt(buyer -> bankQuantity(buyer.getId(), LOGS)).sum();
        assertEquals(10, bought);
    }

    @Test
    void threePlayerTournamentRunsToCompletionAndUpdatesRatings() {
        Player first = register("Woox");
        Player second = register("Odablock");
        Player third = register("Framed");

        Tournament tournament = tournamentService.createTournament("Castle Wars Cup", BattleCategory.OSRS, 4);
        for (Player player : List.of(first, second, third)) {
            tournamentService.registerParticipant(tournament.getId(), player.getId());
        }

        TournamentBracket roundOne = tournamentService.advanceTournamentRound(tournament.getId());
        assertEquals(TournamentStatus.IN_PROGRESS, roundOne.tournament().getStatus());
        assertEquals(1, roundOne.matches().stream().filter(TournamentMatch::isBye).count());

        TournamentMatch opener = roundOne.matches().stream()
                .filter(match -> !match.isBye())
                .findFirst()
                .orElseThrow();
        playMatch(opener, "cup-round-1");

        TournamentBracket roundTwo = tournamentService.advanceTournamentRound(tournament.getId());
        TournamentMatch finalMatch = roundTwo.matches().stream()
                .filter(match -> match.getRound() == 2)
                .findFirst()
                .orElseThrow();
        assertFalse(finalMatch.isBye());
        Long champion = playMatch(finalMatch, "cup-final");

        TournamentBracket finished = tournamentService.getBracket(tournament.getId());
        assertEquals(TournamentStatus.COMPLETED, finished.tournament().getStatus());
        assertEquals(champion, finished.tournament().getWinnerId());
        assertEquals(2, finished.participants().stream().filter(TournamentParticipant::isEliminated).count());
        assertTrue(finished.matches().stream().allMatch(match -> match.getStatus() == TournamentMatchStatus.COMPLETED));

        BattleRating championRating = battleRatingRepository
                .findByPlayerIdAndCategory(champion, BattleCategory.OSRS)
                .orElseThrow();
        assertEquals(2, championRating.getWins());
        assertTrue(championRating.getRating() > 1000.0);
    }

    @Test
    void replayedBattleKeyDoesNotRateTwice() {
        Player a = register("Attacker");
        Player b = register("Defender");
        RecordBattleCommand command = new RecordBattleCommand(
                "duel-replay", BattleCategory.PET, a.getId(), b.getId(), BattleOutcome.PARTICIPANT_B_WON, null, null, null
        );

        BattleResult first = battleRatingService.recordBattle(command);
        BattleResult second = battleRatingService.recordBattle(command);

        assertFalse(first.replayed());
        assertTrue(second.replayed());
        assertEquals(first.record().getId(), second.record().getId());
        BattleRating winner = battleRatingRepository.findByPlayerIdAndCategory(b.getId(), BattleCategory.PET).orElseThrow();
        assertEquals(1, winner.getTotalBattles());
    }

    @Test
    void inactivityDecayGrowsIdleRatingsOncePerInstant() {
        Player a = register("Idler");
        Player b = register("Sleeper");
        battleRatingService.recordBattle(new RecordBattleCommand(
                "duel-idle", BattleCategory.OSRS, a.getId(), b.getId(), BattleOutcome.PARTICIPANT_A_WON, null, null, null
        ));
        jdbcTemplate.update("UPDATE battle_ratings SET last_battle_at = NOW() - INTERVAL '30 days'");
        OffsetDateTime now = OffsetDateTime.now();

        RatingMaintenanceService.DecaySummary first = ratingMaintenanceService.applyInactivityDecay(now);
        RatingMaintenanceService.DecaySummary second = ratingMaintenanceService.applyInactivityDecay(now);

        assertEquals(2, first.ratingsScanned());
        assertEquals(2, first.ratingsUpdated());
        assertEquals(0, second.ratingsUpdated());
        BattleRating idle = battleRatingRepository.findByPlayerIdAndCategory(a.getId(), BattleCategory.OSRS).orElseThrow();
        assertTrue(idle.getUncertainty() > idle.getLastBattleUncertainty());
    }

    @Test
    void retriedCollectionLogDropCountsOnce() {
        Player player = register("Woodcutter");

        CollectionLogResult first = collectionLogService.recordObtained(player.getId(), LOGS, 4L, "tree-1");
        CollectionLogResult retried = collectionLogService.recordObtained(player.getId(), LOGS, 4L, "tree-1");
        CollectionLogResult next = collectionLogService.recordObtained(player.getId(), LOGS, 2L, "tree-2");

        assertTrue(first.firstTime());
        assertTrue(retried.replayed());
        assertEquals(4L, retried.quantityObtained());
        assertEquals(6L, next.quantityObtained());
        assertEquals(6L, collectionLogService.listEntries(player.getId()).get(0).getQuantityObtained());
    }

    private Long playMatch(TournamentMatch match, String battleKey) {
        tournamentService.scheduleMatch(match.getId(), null);
        battleRatingService.recordBattle(new RecordBattleCommand(
                battleKey,
                BattleCategory.OSRS,
                match.getParticipantAId(),
                match.getParticipantBId(),
                BattleOutcome.PARTICIPANT_A_WON,
                null,
                match.getId(),
                null
        ));
        return match.getParticipantAId();
    }

    private Player register(String displayName) {
        return playerService.registerPlayer(ACCOUNT_IDS.incrementAndGet(), displayName, 301, true, GameMode.NORMAL);
    }

    private int bankQuantity(Long playerId, Integer itemId) {
        return containerSlotRepository
                .findByPlayerIdAndContainerAndItemIdOrderBySlotIndexAsc(playerId, ContainerType.BANK, itemId)
                .stream()
                .mapToInt(ContainerSlot::getQuantity)
                .sum();
    }
}
