package com.runeledger.controller;

import com.runeledger.dto.ExchangeRequests;
import com.runeledger.dto.ExchangeResponses;
import com.runeledger.mapper.GameStateResponseMapper;
import com.runeledger.service.ExchangeService;
import com.runeledger.service.OrderSubmissionResult;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API for the Grand Exchange.
 */
@RestController
@RequestMapping("/api/exchange")
public class ExchangeController {

    private final ExchangeService exchangeService;
    private final GameStateResponseMapper responseMapper;

    public ExchangeController(ExchangeService exchangeService, GameStateResponseMapper responseMapper) {
        this.exchangeService = exchangeService;
        this.responseMapper = responseMapper;
    }

    @PostMapping("/orders")
    public ResponseEntity<ExchangeResponses.Submission> submitOrder(
            @Valid @RequestBody ExchangeRequests.SubmitOrderRequest request
    ) {
        OrderSubmissionResult result = exchangeService.submitOrder(
                request.playerId(),
                request.itemId(),
                request.side(),
                request.quantity(),
                request.pricePerUnit()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(responseMapper.toSubmissionResponse(result));
    }

    @PostMapping("/orders/{orderId}/cancel")
    public ResponseEntity<ExchangeResponses.Order> cancelOrder(
            @PathVariable Long orderId,
            @Valid @RequestBody ExchangeRequests.CancelOrderRequest request
    ) {
        return ResponseEntity.ok(responseMapper.toOrderResponse(exchangeService.cancelOrder(request.playerId(), orderId)));
    }

    @GetMapping("/orders/{orderId}")
    public ResponseEntity<ExchangeResponses.Order> getOrder(@PathVariable Long orderId) {
        return ResponseEntity.ok(responseMapper.toOrderResponse(exchangeService.getOrder(orderId)));
    }

    @GetMapping("/players/{playerId}/orders")
    public ResponseEntity<List<ExchangeResponses.Order>> listPlayerOrders(@PathVariable Long playerId) {
        return ResponseEntity.ok(responseMapper.toOrderResponses(exchangeService.listPlayerOrders(playerId)));
    }

    @GetMapping("/items/{itemId}/depth")
    public ResponseEntity<ExchangeResponses.Depth> getDepth(@PathVariable Integer itemId) {
        return ResponseEntity.ok(responseMapper.toDepthResponse(exchangeService.getDepth(itemId)));
    }

    @GetMapping("/items/{itemId}/history")
    public ResponseEntity<List<ExchangeResponses.Trade>> getPriceHistory(
            @PathVariable Integer itemId,
            @RequestParam(required = false) Integer days
    ) {
        return ResponseEntity.ok(responseMapper.toTradeResponses(exchangeService.getPriceHistory(itemId, days)));
    }

    @GetMapping("/items/{itemId}/summary")
    public ResponseEntity<List<ExchangeResponses.DailySummary>> getDailySummary(
            @PathVariable Integer itemId,
            @RequestParam(required = false) Integer days
    ) {
        return ResponseEntity.ok(exchangeService.getDailySummary(itemId, days).stream()
                .map(responseMapper::toDailySummaryResponse)
                .toList());
    }
}
