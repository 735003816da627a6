package io.spotbot.trade.service;

import io.spotbot.configs.properties.BotProperties;
import io.spotbot.trade.dao.TradeRepository;
import io.spotbot.trade.exceptions.TradeNotFoundException;
import io.spotbot.trade.model.Trade;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Trade storage scoped to the configured bot id.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradeServiceImpl implements TradeService {
    private final TradeRepository repository;
    private final BotProperties properties;

    @Override
    public Trade create(Trade trade) {
        trade.setBotId(properties.getBotId());
        Trade saved = repository.save(trade);
        log.info("Trade {} created for {}", saved.getId(), saved.getPair());
        return saved;
    }

    @Override
    public Trade save(Trade trade) {
        return repository.save(trade);
    }

    @Override
    public void delete(Trade trade) {
        repository.delete(trade);
        log.info("Trade {} for {} deleted", trade.getId(), trade.getPair());
    }

    @Override
    public Trade getById(String id) {
        return repository.findById(id)
                .filter(t -> t.getBotId() == properties.getBotId())
                .orElseThrow(TradeNotFoundException::new);
    }

    @Override
    public List<Trade> getOpenTrades() {
        return repository.findAllByBotIdAndOpenTrue(properties.getBotId());
    }

    @Override
    public List<Trade> getClosedTrades() {
        return repository.findAllByBotIdAndOpenFalseOrderByCloseDateAsc(properties.getBotId());
    }

    @Override
    public List<Trade> getTradesWithOpenOrders() {
        return repository.findAllByBotIdAndOpenOrderIdIsNotNull(properties.getBotId());
    }

    @Override
    public long countOpenTrades() {
        return repository.countByBotIdAndOpenTrue(properties.getBotId());
    }
}
