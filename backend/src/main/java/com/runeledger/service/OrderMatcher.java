package com.runeledger.service;

import com.runeledger.model.ExchangeOrder;
import com.runeledger.model.OrderSide;
import com.runeledger.model.OrderStatus;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

/**
 * Price-time priority matching of one incoming order against the resting orders of the opposite side.
 *
 * A BUY takes the cheapest SELLs priced at or below its limit; a SELL takes the richest BUYs priced at
 * or above its limit. Equal prices fill the earliest order first (created_at, then id). Every fill
 * trades at the resting order's price.
 */
@Component
public class OrderMatcher {

    private static final Comparator<ExchangeOrder> TIME_PRIORITY = Comparator
            .comparing(ExchangeOrder::getCreatedAt)
            .thenComparing(ExchangeOrder::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private static final Comparator<ExchangeOrder> ASK_PRIORITY = Comparator
            .comparing(ExchangeOrder::getPricePerUnit)
            .thenComparing(TIME_PRIORITY);

    private static final Comparator<ExchangeOrder> BID_PRIORITY = Comparator
            .comparing(ExchangeOrder::getPricePerUnit, Comparator.reverseOrder())
            .thenComparing(TIME_PRIORITY);

    /**
     * Plans the fills for {@code incoming} without mutating any order.
     */
    public List<Fill> match(ExchangeOrder incoming, List<ExchangeOrder> restingOrders, boolean allowSelfMatch) {
        return match(incoming, restingOrders, allowSelfMatch, resting -> true);
    }

    /**
     * Same as {@link #match(ExchangeOrder, List, boolean)}, passing over crossing resting orders that
     * {@code canSettle} rejects. Rejected orders keep their place in the book.
     */
    public List<Fill> match(
            ExchangeOrder incoming,
            List<ExchangeOrder> restingOrders,
            boolean allowSelfMatch,
            Predicate<ExchangeOrder> canSettle
    ) {
        if (incoming.getSide() == null) {
            throw new IllegalArgumentException("incoming order side is required");
        }
        OrderSide restingSide = incoming.getSide().opposite();
        List<ExchangeOrder> book = new ArrayList<>(restingOrders.size());
        for (ExchangeOrder resting : restingOrders) {
            if (resting.getSide() == restingSide
                    && resting.getStatus() == OrderStatus.ACTIVE
                    && resting.getItemId().equals(incoming.getItemId())
                    && resting.remainingQuantity() > 0
                    && (allowSelfMatch || !resting.getPlayerId().equals(incoming.getPlayerId()))) {
                book.add(resting);
            }
        }
        book.sort(incoming.getSide() == OrderSide.BUY ? ASK_PRIORITY : BID_PRIORITY);

        List<Fill> fills = new ArrayList<>();
        int outstanding = incoming.remainingQuantity();
        for (ExchangeOrder resting : book) {
            if (outstanding == 0 || !pricesCross(incoming, resting)) {
                break;
            }
            if (!canSettle.test(resting)) {
                continue;
            }
            int quantity = Math.min(outstanding, resting.remainingQuantity());
            fills.add(new Fill(resting, quantity, resting.getPricePerUnit()));
            outstanding -= quantity;
        }
        return fills;
    }

    private static boolean pricesCross(ExchangeOrder incoming, ExchangeOrder resting) {
        if (incoming.getSide() == OrderSide.BUY) {
            return resting.getPricePerUnit() <= incoming.getPricePerUnit();
        }
        return resting.getPricePerUnit() >= incoming.getPricePerUnit();
    }

    public record Fill(
            ExchangeOrder resting,
            int quantity,
            long pricePerUnit
    ) {
    }
}
