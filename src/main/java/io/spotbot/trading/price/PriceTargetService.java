package io.spotbot.trading.price;

import io.spotbot.configs.properties.BotProperties;
import io.spotbot.exchange.ExchangeService;
import io.spotbot.exchange.model.OrderBook;
import io.spotbot.exchange.model.Ticker;
import io.spotbot.helpers.MathHelper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

import static io.spotbot.helpers.MathHelper.MC;

@Slf4j
@Component
@RequiredArgsConstructor
public class PriceTargetService {
    private final ExchangeService exchangeService;
    private final BotProperties properties;

    /**
     * Entry price: the ask if it is below the last price, otherwise a blend of ask and last
     * ({@code ask-last-balance}: 0 = ask, 1 = last). With the order book enabled the bid at
     * {@code book-order-top} plus one satoshi is used, unless the ticker rate is lower.
     */
    public BigDecimal getTargetBid(String pair) {
        Ticker ticker = exchangeService.getTicker(pair);
        log.debug("Ticker data {}", ticker);

        BigDecimal tickerRate;
        if (ticker.getAsk().compareTo(ticker.getLast()) < 0) {
            tickerRate = ticker.getAsk();
        } else {
            BigDecimal balance = properties.getBidStrategy().getAskLastBalance();
            tickerRate = ticker.getAsk().add(balance.multiply(ticker.getLast().subtract(ticker.getAsk()), MC), MC);
        }

        BotProperties.BidStrategy bidStrategy = properties.getBidStrategy();
        BigDecimal usedRate = tickerRate;
        if (bidStrategy.isUseBookOrder()) {
            int top = bidStrategy.getBookOrderTop();
            OrderBook orderBook = exchangeService.getOrderBook(pair, top);
            BigDecimal bookRate = orderBook.bidPrice(top).add(MathHelper.PRICE_EPSILON);
            log.info("...book order buy rate {} for {}", bookRate, pair);
            if (tickerRate.compareTo(bookRate) < 0) {
                log.info("...using ticker rate instead {}", tickerRate);
                usedRate = tickerRate;
            } else {
                usedRate = bookRate;
            }
        } else {
            log.debug("Using last ask / last price for {}", pair);
        }

        BigDecimal percentFromTop = bidStrategy.getPercentFromTop();
        if (percentFromTop != null && percentFromTop.signum() > 0) {
            usedRate = MathHelper.trunc(usedRate.subtract(usedRate.multiply(percentFromTop, MC)), MathHelper.PRICE_SCALE);
            log.info("...percent from top enabled, new buy rate {}", usedRate);
        }
        return usedRate;
    }
}
