package com.runeledger.service;

import com.runeledger.config.RuneLedgerProperties;
import com.runeledger.model.ExchangeItemBook;
import com.runeledger.model.ExchangeOrder;
import com.runeledger.model.ExchangeTrade;
import com.runeledger.model.ItemDefinition;
import com.runeledger.model.OrderSide;
import com.runeledger.model.OrderStatus;
import com.runeledger.model.Player;
import com.runeledger.model.PriceTrend;
import com.runeledger.repository.ExchangeItemBookRepository;
import com.runeledger.repository.ExchangeOrderRepository;
import com.runeledger.repository.ExchangeTradeRepository;
import com.runeledger.repository.ItemDefinitionRepository;
import com.runeledger.repository.OrderBookLevelRow;
import com.runeledger.repository.PlayerRepository;
import com.runeledger.web.GameStateException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Grand Exchange order book.
 *
 * Matching for an item is serialized by the row lock on its {@code exchange_item_books} row. Submitting
 * reserves the stake up front (coins for a BUY, banked items for a SELL); each fill settles both
 * sides in the same transaction and a buyer who bid above the trade price is refunded the difference.
 */
@Service
@RequiredArgsConstructor
public class ExchangeService {

    private static final Logger log = LoggerFactory.getLogger(ExchangeService.class);

    private final ExchangeOrderRepository exchangeOrderRepository;
    private final ExchangeTradeRepository exchangeTradeRepository;
    private final ExchangeItemBookRepository exchangeItemBookRepository;
    private final ItemDefinitionRepository itemDefinitionRepository;
    private final PlayerRepository playerRepository;
    private final ItemLedgerService itemLedgerService;
    private final OrderMatcher orderMatcher;
    private final RuneLedgerProperties runeLedgerProperties;
    private final TransactionRetryExecutor transactionRetryExecutor;

    public OrderSubmissionResult submitOrder(
            Long playerId,
            Integer itemId,
            OrderSide side,
            int quantity,
            long pricePerUnit
    ) {
        validateOrder(itemId, side, quantity, pricePerUnit);
        return transactionRetryExecutor.execute(
                "submitOrder",
                () -> submitInTransaction(playerId, itemId, side, quantity, pricePerUnit)
        );
    }

    private OrderSubmissionResult submitInTransaction(
            Long playerId,
            Integer itemId,
            OrderSide side,
            int quantity,
            long pricePerUnit
    ) {
        ItemDefinition item = itemDefinitionRepository.findById(itemId)
                .orElseThrow(() -> GameStateException.itemNotFound(itemId));
        if (!item.isTradeable()) {
            throw GameStateException.itemNotTradeable(item.getName() + " cannot be traded on the exchange");
        }

        ExchangeItemBook book = lockItemBook(itemId);
        Player player = playerRepository.findByIdForUpdate(playerId)
                .orElseThrow(() -> GameStateException.playerNotFound(playerId));
        PlayerService.requireActive(player);
        OffsetDateTime now = OffsetDateTime.now();

        if (side == OrderSide.BUY) {
            enforceBuyLimit(playerId, item, quantity, now);
            itemLedgerService.debitCoins(playerId, totalValue(quantity, pricePerUnit));
        } else {
            itemLedgerService.takeFromBank(playerId, itemId, quantity);
        }

        ExchangeOrder order = new ExchangeOrder();
        order.setPlayerId(playerId);
        order.setItemId(itemId);
        order.setSide(side);
        order.setQuantity(quantity);
        order.setPricePerUnit(pricePerUnit);
        order.setQuantityFilled(0);
        order.setStatus(OrderStatus.ACTIVE);
        order.setCreatedAt(now);
        order.setUpdatedAt(now);
        order = exchangeOrderRepository.save(order);

        List<ExchangeOrder> resting = side == OrderSide.BUY
                ? exchangeOrderRepository
                .findByItemIdAndSideAndStatusAndPricePerUnitLessThanEqualOrderByPricePerUnitAscCreatedAtAscIdAsc(
                        itemId, OrderSide.SELL, OrderStatus.ACTIVE, pricePerUnit)
                : exchangeOrderRepository
                .findByItemIdAndSideAndStatusAndPricePerUnitGreaterThanEqualOrderByPricePerUnitDescCreatedAtAscIdAsc(
                        itemId, OrderSide.BUY, OrderStatus.ACTIVE, pricePerUnit);

        List<OrderMatcher.Fill> fills = orderMatcher.match(
                order,
                resting,
                runeLedgerProperties.getExchange().isAllowSelfMatch(),
                side == OrderSide.SELL ? this::buyerCanReceive : restingOrder -> true
        );

        List<ExchangeTrade> trades = new ArrayList<>(fills.size());
        long coinsRefunded = 0;
        for (OrderMatcher.Fill fill : fills) {
            trades.add(executeFill(order, fill, book, now));
            if (side == OrderSide.BUY) {
                coinsRefunded += (pricePerUnit - fill.pricePerUnit()) * fill.quantity();
            }
        }
        exchangeOrderRepository.save(order);
        if (!trades.isEmpty()) {
            book.setUpdatedAt(now);
            exchangeItemBookRepository.save(book);
        }

        log.info(
                "Order {} {} {} x item {} @ {} by player {}: {} fills, status {}",
                order.getId(),
                side,
                quantity,
                itemId,
                pricePerUnit,
                playerId,
                trades.size(),
                order.getStatus()
        );
        return new OrderSubmissionResult(order, trades, coinsRefunded);
    }

    private ExchangeTrade executeFill(
            ExchangeOrder incoming,
            OrderMatcher.Fill fill,
            ExchangeItemBook book,
            OffsetDateTime now
    ) {
        ExchangeOrder resting = fill.resting();
        int quantity = fill.quantity();
        if (quantity <= 0 || quantity > incoming.remainingQuantity() || quantity > resting.remainingQuantity()) {
            throw GameStateException.overFill(
                    "Fill of " + quantity + " exceeds remaining quantity of order "
                            + incoming.getId() + " or " + resting.getId()
            );
        }

        ExchangeOrder buy = incoming.getSide() == OrderSide.BUY ? incoming : resting;
        ExchangeOrder sell = incoming.getSide() == OrderSide.SELL ? incoming : resting;
        long price = fill.pricePerUnit();

        ExchangeTrade trade = new ExchangeTrade();
        trade.setItemId(incoming.getItemId());
        trade.setBuyOrderId(buy.getId());
        trade.setSellOrderId(sell.getId());
        trade.setBuyerId(buy.getPlayerId());
        trade.setSellerId(sell.getPlayerId());
        trade.setQuantity(quantity);
        trade.setPricePerUnit(price);
        trade.setExecutedAt(now);
        trade = exchangeTradeRepository.save(trade);

        applyFill(incoming, quantity, now);
        applyFill(resting, quantity, now);
        exchangeOrderRepository.save(resting);

        itemLedgerService.addToBank(buy.getPlayerId(), incoming.getItemId(), quantity);
        itemLedgerService.creditCoins(sell.getPlayerId(), totalValue(quantity, price));
        long improvement = (buy.getPricePerUnit() - price) * quantity;
        if (improvement > 0) {
            itemLedgerService.creditCoins(buy.getPlayerId(), improvement);
        }

        recordTradeOnBook(book, price, quantity, now);
        log.debug(
                "Trade {}: {} x item {} @ {} (buy order {}, sell order {})",
                trade.getId(),
                quantity,
                trade.getItemId(),
                price,
                buy.getId(),
                sell.getId()
        );
        return trade;
    }

    private boolean buyerCanReceive(ExchangeOrder bid) {
        if (!itemLedgerService.isBankFullFor(bid.getPlayerId(), bid.getItemId())) {
            return true;
        }
        log.warn(
                "Skipping buy order {} of player {}: bank has no room for item {}",
                bid.getId(),
                bid.getPlayerId(),
                bid.getItemId()
        );
        return false;
    }

    /**
     * Cancels the unfilled remainder of an active order and releases exactly that remainder.
     */
    public ExchangeOrder cancelOrder(Long playerId, Long orderId) {
        return transactionRetryExecutor.execute("cancelOrder", () -> {
            Integer itemId = exchangeOrderRepository.findItemIdById(orderId)
                    .orElseThrow(() -> GameStateException.notFound("ORDER_NOT_FOUND", "Order not found: " + orderId));
            lockItemBook(itemId);
            ExchangeOrder order = exchangeOrderRepository.findByIdForUpdate(orderId)
                    .orElseThrow(() -> GameStateException.notFound("ORDER_NOT_FOUND", "Order not found: " + orderId));

            if (!order.getPlayerId().equals(playerId)) {
                throw GameStateException.orderNotOwned("Order " + orderId + " belongs to another player");
            }
            if (order.getStatus() != OrderStatus.ACTIVE) {
                throw GameStateException.orderNotCancellable("Order " + orderId + " is " + order.getStatus());
            }
            long traded = exchangeTradeRepository.sumQuantityByOrderId(orderId);
            if (traded != order.getQuantityFilled()) {
                throw GameStateException.invariantViolation(
                        "FILL_MISMATCH",
                        "Order " + orderId + " records " + order.getQuantityFilled() + " filled but trades total " + traded
                );
            }

            int remaining = order.remainingQuantity();
            if (order.getSide() == OrderSide.BUY) {
                itemLedgerService.creditCoins(playerId, totalValue(remaining, order.getPricePerUnit()));
            } else {
                itemLedgerService.addToBank(playerId, order.getItemId(), remaining);
            }

            OffsetDateTime now = OffsetDateTime.now();
            order.setStatus(OrderStatus.CANCELLED);
            order.setCancelledAt(now);
            order.setUpdatedAt(now);
            log.info(
                    "Order {} cancelled by player {}: released {} of {} (filled {})",
                    orderId,
                    playerId,
                    remaining,
                    order.getQuantity(),
                    order.getQuantityFilled()
            );
            return exchangeOrderRepository.save(order);
        });
    }

    @Transactional(readOnly = true)
    public ExchangeOrder getOrder(Long orderId) {
        return exchangeOrderRepository.findById(orderId)
                .orElseThrow(() -> GameStateException.notFound("ORDER_NOT_FOUND", "Order not found: " + orderId));
    }

    @Transactional(readOnly = true)
    public List<ExchangeOrder> listPlayerOrders(Long playerId) {
        return exchangeOrderRepository.findByPlayerIdOrderByCreatedAtDescIdDesc(playerId);
    }

    @Transactional(readOnly = true)
    public OrderBookDepth getDepth(Integer itemId) {
        if (!itemDefinitionRepository.existsById(itemId)) {
            throw GameStateException.itemNotFound(itemId);
        }
        List<OrderBookDepth.Level> bids = toLevels(
                exchangeOrderRepository.findDepthLevels(itemId, OrderSide.BUY, OrderStatus.ACTIVE)
        );
        Collections.reverse(bids);
        List<OrderBookDepth.Level> asks = toLevels(
                exchangeOrderRepository.findDepthLevels(itemId, OrderSide.SELL, OrderStatus.ACTIVE)
        );

        ExchangeItemBook book = exchangeItemBookRepository.findById(itemId).orElse(null);
        if (book == null) {
            return new OrderBookDepth(itemId, bids, asks, null, PriceTrend.STABLE, 0L);
        }
        long dailyVolume = today(OffsetDateTime.now()).equals(book.getVolumeDate()) ? book.getDailyVolume() : 0L;
        return new OrderBookDepth(itemId, bids, asks, book.getLastTradePrice(), book.getPriceTrend(), dailyVolume);
    }

    @Transactional(readOnly = true)
    public List<ExchangeTrade> getPriceHistory(Integer itemId, Integer days) {
        return exchangeTradeRepository.findByItemIdAndExecutedAtGreaterThanEqualOrderByExecutedAtAscIdAsc(
                itemId,
                windowStart(days)
        );
    }

    /**
     * Per-day (UTC) volume-weighted average price and volume over the window.
     */
    @Transactional(readOnly = true)
    public List<DailyPriceSummary> getDailySummary(Integer itemId, Integer days) {
        Map<LocalDate, List<ExchangeTrade>> byDay = new TreeMap<>();
        for (ExchangeTrade trade : getPriceHistory(itemId, days)) {
            byDay.computeIfAbsent(today(trade.getExecutedAt()), ignored -> new ArrayList<>()).add(trade);
        }

        List<DailyPriceSummary> summaries = new ArrayList<>(byDay.size());
        byDay.forEach((date, trades) -> {
            long volume = 0;
            long turnover = 0;
            long low = Long.MAX_VALUE;
            long high = Long.MIN_VALUE;
            for (ExchangeTrade trade : trades) {
                volume += trade.getQuantity();
                turnover += trade.getQuantity() * trade.getPricePerUnit();
                low = Math.min(low, trade.getPricePerUnit());
                high = Math.max(high, trade.getPricePerUnit());
            }
            summaries.add(new DailyPriceSummary(date, turnover / volume, low, high, volume, trades.size()));
        });
        return summaries;
    }

    private void validateOrder(Integer itemId, OrderSide side, int quantity, long pricePerUnit) {
        RuneLedgerProperties.Exchange limits = runeLedgerProperties.getExchange();
        if (itemId == null) {
            throw GameStateException.validation("ITEM_REQUIRED", "itemId is required");
        }
        if (side == null) {
            throw GameStateException.validation("SIDE_REQUIRED", "side is required");
        }
        if (quantity <= 0 || quantity > limits.getMaxOrderQuantity()) {
            throw GameStateException.validation(
                    "INVALID_QUANTITY",
                    "quantity must be between 1 and " + limits.getMaxOrderQuantity()
            );
        }
        if (pricePerUnit <= 0 || pricePerUnit > limits.getMaxPricePerUnit()) {
            throw GameStateException.validation(
                    "INVALID_PRICE",
                    "pricePerUnit must be between 1 and " + limits.getMaxPricePerUnit()
            );
        }
    }

    private void enforceBuyLimit(Long playerId, ItemDefinition item, int quantity, OffsetDateTime now) {
        Integer buyLimit = item.getBuyLimit();
        if (buyLimit == null) {
            return;
        }
        OffsetDateTime since = now.minusHours(runeLedgerProperties.getExchange().getBuyLimitWindowHours());
        long committed = exchangeOrderRepository.sumCommittedQuantitySince(
                playerId,
                item.getId(),
                OrderSide.BUY,
                OrderStatus.CANCELLED,
                since
        );
        if (committed + quantity > buyLimit) {
            throw GameStateException.buyLimitExceeded(
                    item.getName() + " has a buy limit of " + buyLimit + " per "
                            + runeLedgerProperties.getExchange().getBuyLimitWindowHours() + " hours; "
                            + committed + " already committed"
            );
        }
    }

    private ExchangeItemBook lockItemBook(Integer itemId) {
        exchangeItemBookRepository.insertIfAbsent(itemId);
        return exchangeItemBookRepository.findByItemIdForUpdate(itemId)
                .orElseThrow(() -> GameStateException.invariantViolation(
                        "ITEM_BOOK_MISSING",
                        "Exchange book for item " + itemId + " could not be created"
                ));
    }

    private static void applyFill(ExchangeOrder order, int quantity, OffsetDateTime now) {
        int filled = order.getQuantityFilled() + quantity;
        if (filled > order.getQuantity()) {
            throw GameStateException.overFill("Order " + order.getId() + " would be filled past its quantity");
        }
        order.setQuantityFilled(filled);
        order.setUpdatedAt(now);
        if (filled == order.getQuantity()) {
            order.setStatus(OrderStatus.COMPLETED);
            order.setCompletedAt(now);
        }
    }

    static void recordTradeOnBook(ExchangeItemBook book, long price, int quantity, OffsetDateTime now) {
        LocalDate day = today(now);
        if (!day.equals(book.getVolumeDate())) {
            book.setVolumeDate(day);
            book.setDailyVolume(0L);
        }
        book.setDailyVolume(book.getDailyVolume() + quantity);

        Long previous = book.getLastTradePrice();
        if (previous != null) {
            book.setPreviousTradePrice(previous);
            if (price > previous) {
                book.setPriceTrend(PriceTrend.RISING);
            } else if (price < previous) {
                book.setPriceTrend(PriceTrend.FALLING);
            } else {
                book.setPriceTrend(PriceTrend.STABLE);
            }
        }
        book.setLastTradePrice(price);
    }

    private OffsetDateTime windowStart(Integer days) {
        int window = days != null && days > 0 ? days : runeLedgerProperties.getExchange().getPriceHistoryDefaultDays();
        return OffsetDateTime.now().minusDays(window);
    }

    private static List<OrderBookDepth.Level> toLevels(List<OrderBookLevelRow> rows) {
        List<OrderBookDepth.Level> levels = new ArrayList<>(rows.size());
        for (OrderBookLevelRow row : rows) {
            levels.add(new OrderBookDepth.Level(row.getPricePerUnit(), row.getRemainingQuantity(), row.getOrderCount()));
        }
        return levels;
    }

    private static LocalDate today(OffsetDateTime at) {
        return at.atZoneSameInstant(ZoneOffset.UTC).toLocalDate();
    }

    private static long totalValue(int quantity, long pricePerUnit) {
        try {
            return Math.multiplyExact(quantity, pricePerUnit);
        } catch (ArithmeticException e) {
            throw GameStateException.validation("ORDER_VALUE_OVERFLOW", "quantity x pricePerUnit overflows");
        }
    }
}
