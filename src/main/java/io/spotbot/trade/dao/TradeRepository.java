package io.spotbot.trade.dao;

import io.spotbot.trade.model.Trade;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface TradeRepository extends MongoRepository<Trade, String> {
    List<Trade> findAllByBotIdAndOpenTrue(int botId);

    List<Trade> findAllByBotIdAndOpenFalseOrderByCloseDateAsc(int botId);

    List<Trade> findAllByBotIdAndOpenOrderIdIsNotNull(int botId);

    long countByBotIdAndOpenTrue(int botId);
}
