package io.spotbot.trade.service;

import io.spotbot.trade.model.Trade;

import java.util.List;

public interface TradeService {
    Trade create(Trade trade);

    Trade save(Trade trade);

    void delete(Trade trade);

    Trade getById(String id);

    List<Trade> getOpenTrades();

    List<Trade> getClosedTrades();

    List<Trade> getTradesWithOpenOrders();

    long countOpenTrades();
}
