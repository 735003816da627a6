package io.spotbot.trading;

import io.spotbot.configs.properties.BotProperties;
import io.spotbot.exceptions.DependencyException;
import io.spotbot.exceptions.OperationalException;
import io.spotbot.exchange.ExchangeService;
import io.spotbot.exchange.enums.OrderStatus;
import io.spotbot.exchange.model.ExchangeOrder;
import io.spotbot.exchange.model.OrderBook;
import io.spotbot.exchange.model.Ticker;
import io.spotbot.klines.enums.IntervalE;
import io.spotbot.notification.FiatConvertService;
import io.spotbot.notification.NotificationService;
import io.spotbot.signal.SignalService;
import io.spotbot.signal.model.Signal;
import io.spotbot.strategy.StrategyResolver;
import io.spotbot.trade.enums.SellType;
import io.spotbot.trade.model.Trade;
import io.spotbot.trade.service.TradeService;
import io.spotbot.trading.decision.SellDecision;
import io.spotbot.trading.price.PriceTargetService;
import io.spotbot.trading.stake.StakeService;
import io.spotbot.trading.updates.OrderUpdatesService;
import io.spotbot.trading.whitelist.WhitelistService;
import io.spotbot.utils.logging.TradingLogWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static io.spotbot.helpers.MathHelper.MC;

@Slf4j
@Service
@RequiredArgsConstructor
public class TradingServiceImpl implements TradingService {
    private static final int DOM_DEPTH = 1000;
    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    private final ExchangeService exchangeService;
    private final TradeService tradeService;
    private final SignalService signalService;
    private final StrategyResolver strategyResolver;
    private final SellDecision sellDecision;
    private final PriceTargetService priceTargetService;
    private final StakeService stakeService;
    private final WhitelistService whitelistService;
    private final OrderUpdatesService orderUpdatesService;
    private final NotificationService notificationService;
    private final FiatConvertService fiatConvertService;
    private final TradingLogWriter tradingLogWriter;
    private final BotProperties properties;
    private final Clock clock;

    @Override
    public boolean processMaybeExecuteSell(Trade trade) {
        try {
            boolean closed = false;
            if (trade.getOpenOrderId() != null) {
                log.info("Found open order {} for {}", trade.getOpenOrderId(), trade.getPair());
                ExchangeOrder order = exchangeService.getOrder(trade.getOpenOrderId(), trade.getPair());

                if (order.getStatus() == OrderStatus.CANCELED) {
                    if (orderUpdatesService.handleCanceledOrder(trade, order)) {
                        return false;
                    }
                    return trade.isOpen() && handleTrade(trade);
                }

                try {
                    BigDecimal newAmount = orderUpdatesService.getRealAmount(trade, order);
                    if (order.getAmount().compareTo(newAmount) != 0) {
                        order = order.toBuilder().amount(newAmount).build();
                        // fee already taken from the amount
                        trade.setFeeOpen(BigDecimal.ZERO);
                    }
                } catch (OperationalException e) {
                    log.warn("Could not update trade amount: {}", e.getMessage());
                }

                boolean wasOpen = trade.isOpen();
                trade.update(order, now());
                tradeService.save(trade);
                if (wasOpen && !trade.isOpen()) {
                    closed = true;
                    log.info("✅ Trade {} closed at {} (profit {})", trade.getPair(), trade.getCloseRate(), trade.getCloseProfit());
                    tradingLogWriter.write(trade.getPair(), "CLOSED",
                            "rate=" + trade.getCloseRate() + " profit=" + trade.getCloseProfit() + " reason=" + trade.getSellReason());
                }
            }

            if (trade.isOpen() && trade.getOpenOrderId() == null) {
                return handleTrade(trade);
            }
            return closed;
        } catch (DependencyException e) {
            log.warn("Unable to sell trade {}: {}", trade.getPair(), e.getMessage());
        }
        return false;
    }

    @Override
    public boolean handleTrade(Trade trade) {
        if (!trade.isOpen()) {
            throw new IllegalStateException("Attempt to handle closed trade: " + trade);
        }

        log.info("Handling {} ...", trade.getPair());
        BigDecimal sellRate = exchangeService.getTicker(trade.getPair()).getBid();
        log.info(" ticker rate {}", sellRate);

        BotProperties.Experimental experimental = properties.getExperimental();
        Signal signal = Signal.NONE;
        if (experimental.isUseSellSignal()) {
            signal = signalService.getSignal(trade.getPair(), strategyResolver.getTickerInterval());
        }

        if (experimental.isSellFullfilledAtRoi()) {
            sellRate = sellDecision.getRoiRate(trade, sellRate, now());
        }

        BigDecimal stopLossBefore = trade.getStopLoss();
        BotProperties.AskStrategy askStrategy = properties.getAskStrategy();
        if (askStrategy.isUseBookOrder()) {
            log.info("Using order book for selling {}", trade.getPair());
            int min = askStrategy.getBookOrderMin();
            OrderBook orderBook = exchangeService.getOrderBook(trade.getPair(), askStrategy.getBookOrderMax());
            // thin books may hold fewer levels than requested
            int max = Math.min(askStrategy.getBookOrderMax(), orderBook.getAsks().size());

            for (int i = min; i <= max; i++) {
                BigDecimal bookRate = orderBook.askPrice(i);
                log.info("  order book asks top {}: {}", i, bookRate);
                // higher ask means more profit, otherwise keep the bid
                if (sellRate.compareTo(bookRate) < 0) {
                    sellRate = bookRate;
                }
                if (checkSell(trade, sellRate, signal.isBuy(), signal.isSell())) {
                    return true;
                }
            }
        } else if (checkSell(trade, sellRate, signal.isBuy(), signal.isSell())) {
            return true;
        }

        if (!Objects.equals(stopLossBefore, trade.getStopLoss())) {
            tradeService.save(trade);
        }
        log.info("Found no sell signal for {}", trade.getPair());
        return false;
    }

    @Override
    public boolean checkSell(Trade trade, BigDecimal sellRate, boolean buy, boolean sell) {
        SellType sellType = sellDecision.shouldSell(trade, sellRate, now(), buy, sell);
        if (sellType.isSell()) {
            executeSell(trade, sellRate, sellType);
            return true;
        }
        return false;
    }

    @Override
    public void executeSell(Trade trade, BigDecimal limit, SellType sellType) {
        String pair = trade.getPair();
        String orderId = exchangeService.sell(pair, limit, trade.getAmount());
        trade.setOpenOrderId(orderId);
        trade.setCloseRateRequested(limit);
        trade.setSellReason(sellType);
        tradeService.save(trade);

        BigDecimal profitPercent = trade.calcProfitPercent(limit).multiply(BigDecimal.valueOf(100)).setScale(2, RoundingMode.HALF_UP);
        BigDecimal profitTrade = trade.calcProfit(limit);
        BigDecimal currentRate = exchangeService.getTicker(pair).getBid();
        String gain = profitPercent.signum() > 0 ? "profit" : "loss";

        String stake = properties.getStakeCurrency();
        String fiat = properties.getFiatDisplayCurrency();
        StringBuilder message = new StringBuilder()
                .append("*").append(exchangeService.getName()).append(":* Selling\n")
                .append("*Current Pair:* [").append(pair).append("](").append(exchangeService.getPairDetailUrl(pair)).append(")\n")
                .append("*Limit:* `").append(limit.toPlainString()).append("`\n")
                .append("*Amount:* `").append(trade.getAmount().setScale(8, RoundingMode.HALF_UP).toPlainString()).append("`\n")
                .append(String.format("*Open Rate:* `%.8f`\n", trade.getOpenRate()))
                .append(String.format("*Current Rate:* `%.8f`\n", currentRate))
                .append(String.format("*Profit:* `%.2f%%`", profitPercent));
        if (stake != null && fiat != null) {
            BigDecimal profitFiat = fiatConvertService.convertAmount(profitTrade, stake, fiat);
            message.append(String.format("` (%s: %.2f%%, %.8f %s`` / %.3f %s)`", gain, profitPercent, profitTrade, stake, profitFiat, fiat));
        } else {
            message.append(String.format("` (%s: %.2f%%, %.8f)`", gain, profitPercent, profitTrade));
        }

        log.info("📤 Sell order {} for {} at {} ({}, {}%)", orderId, pair, limit, sellType, profitPercent);
        tradingLogWriter.write(pair, "SELL_PLACED",
                "order=" + orderId + " limit=" + limit + " amount=" + trade.getAmount() + " reason=" + sellType + " profit=" + profitPercent + "%");
        notificationService.send(message.toString());
    }

    @Override
    public boolean processMaybeExecuteBuy() {
        try {
            if (createTrade()) {
                return true;
            }
            log.info("Found no buy signals for whitelisted currencies. Trying again..");
            return false;
        } catch (DependencyException e) {
            log.warn("Unable to create trade: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public boolean createTrade() {
        BigDecimal stakeAmount = stakeService.getStakeAmount();
        IntervalE interval = strategyResolver.getTickerInterval();
        String stakeCurrency = properties.getStakeCurrency();
        String fiatCurrency = properties.getFiatDisplayCurrency();

        log.info("Checking buy signals to create a new trade with stake amount: {} ...", stakeAmount);
        List<String> whitelist = new ArrayList<>(whitelistService.getActiveWhitelist());

        BigDecimal balance = exchangeService.getBalance(stakeCurrency);
        if (balance.compareTo(stakeAmount) < 0) {
            throw new DependencyException("stake amount is not fulfilled (currency=" + stakeCurrency + ")");
        }

        for (Trade trade : tradeService.getOpenTrades()) {
            if (whitelist.remove(trade.getPair())) {
                log.debug("Ignoring {} in pair whitelist", trade.getPair());
            }
        }
        if (whitelist.isEmpty()) {
            throw new DependencyException("No currency pairs in whitelist");
        }

        String pair = null;
        for (String candidate : whitelist) {
            Signal signal = signalService.getSignal(candidate, interval);
            if (signal.isBuy() && !signal.isSell() && passesBuyFilters(candidate)) {
                pair = candidate;
                break;
            }
        }
        if (pair == null) {
            return false;
        }

        BigDecimal buyLimit = priceTargetService.getTargetBid(pair);
        BigDecimal amount = stakeAmount.divide(buyLimit, MC);
        String orderId = exchangeService.buy(pair, buyLimit, amount);

        BigDecimal stakeFiat = fiatConvertService.convertAmount(stakeAmount, stakeCurrency, fiatCurrency);
        notificationService.send(String.format("*%s:* Buying [%s](%s) with limit `%.8f (%.6f %s, %.3f %s)`",
                exchangeService.getName(), pair, exchangeService.getPairDetailUrl(pair),
                buyLimit, stakeAmount, stakeCurrency, stakeFiat, fiatCurrency));

        // limit buy and limit sell, maker fee both ways
        BigDecimal fee = exchangeService.getFee(pair, ExchangeService.FeeType.MAKER);
        Trade trade = Trade.builder()
                .pair(pair)
                .exchange(exchangeService.getName())
                .stakeAmount(stakeAmount)
                .amount(amount)
                .feeOpen(fee)
                .feeClose(fee)
                .openRate(buyLimit)
                .openRateRequested(buyLimit)
                .openDate(now())
                .openOrderId(orderId)
                .build();
        tradeService.create(trade);

        log.info("📥 Buy order {} for {} at {} (amount={}, stake={})", orderId, pair, buyLimit, amount, stakeAmount);
        tradingLogWriter.write(pair, "BUY_PLACED", "order=" + orderId + " limit=" + buyLimit + " amount=" + amount + " stake=" + stakeAmount);
        return true;
    }

    @Override
    public Trade forceSell(String tradeId) {
        Trade trade = tradeService.getById(tradeId);
        if (!trade.isOpen()) {
            throw new IllegalStateException("Trade " + tradeId + " is already closed");
        }
        if (trade.getOpenOrderId() != null) {
            throw new IllegalStateException("Trade " + tradeId + " has a pending order " + trade.getOpenOrderId());
        }
        Ticker ticker = exchangeService.getTicker(trade.getPair());
        executeSell(trade, ticker.getBid(), SellType.FORCE_SELL);
        return trade;
    }

    /**
     * Depth of market: bid/ask volume ratio of the book must reach {@code dom-bids-asks-delta}.
     * Optionally the ask has to be above the middle of the 24h range.
     */
    private boolean passesBuyFilters(String pair) {
        BotProperties.Experimental experimental = properties.getExperimental();

        if (experimental.isCheckDepthOfMarket() && experimental.getDomBidsAsksDelta().signum() > 0) {
            OrderBook orderBook = exchangeService.getOrderBook(pair, DOM_DEPTH);
            BigDecimal bids = orderBook.totalBidVolume();
            BigDecimal asks = orderBook.totalAskVolume();
            if (asks.signum() > 0) {
                BigDecimal delta = bids.divide(asks, MC);
                log.info("Depth of market for {}: bids={}, asks={}, delta={}", pair, bids, asks, delta);
                if (delta.compareTo(experimental.getDomBidsAsksDelta()) < 0) {
                    return false;
                }
            }
        }

        if (experimental.isBuyPriceBelow24hHL()) {
            Ticker ticker = exchangeService.getTicker(pair);
            BigDecimal middle = ticker.getHigh().add(ticker.getLow()).divide(TWO, MC);
            log.info("Checking ask {} of {} against 24h high {} / low {}", ticker.getAsk(), pair, ticker.getHigh(), ticker.getLow());
            return ticker.getAsk().compareTo(middle) > 0;
        }
        return true;
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
