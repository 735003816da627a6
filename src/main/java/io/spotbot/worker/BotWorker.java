package io.spotbot.worker;

import io.spotbot.configs.properties.BotProperties;
import io.spotbot.exceptions.TemporaryException;
import io.spotbot.notification.NotificationService;
import io.spotbot.strategy.StrategyResolver;
import io.spotbot.trade.model.Trade;
import io.spotbot.trade.service.TradeService;
import io.spotbot.trading.TradingService;
import io.spotbot.trading.updates.OrderUpdatesService;
import io.spotbot.trading.whitelist.WhitelistService;
import io.spotbot.worker.enums.BotState;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Single threaded control loop: every tick sells what should be sold, then looks for one buy,
 * then sweeps timed out orders. Ticks never overlap.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BotWorker {
    static final Duration RETRY_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration STOPPED_SLEEP = Duration.ofSeconds(1);
    private static final String RESTART_HINT = "Issue `/start` if you think it is safe to restart.";

    private final BotStateHolder stateHolder;
    private final WhitelistService whitelistService;
    private final TradeService tradeService;
    private final TradingService tradingService;
    private final OrderUpdatesService orderUpdatesService;
    private final NotificationService notificationService;
    private final StrategyResolver strategyResolver;
    private final BotProperties properties;
    private final Clock clock;

    private final ReentrantLock tickLock = new ReentrantLock();
    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "bot-worker");
        t.setDaemon(true);
        return t;
    });
    private volatile boolean shutdown;

    public void start() {
        log.info("🚀 Starting bot {} in state {}", properties.getBotId(), stateHolder.get());
        if (properties.isDryRun()) {
            orderUpdatesService.settleDryRunOrders(LocalDateTime.now(clock));
        }
        executor.submit(this::loop);
    }

    private void loop() {
        BotState oldState = null;
        try {
            while (!shutdown) {
                oldState = safeWorker(oldState);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Bot worker interrupted");
        }
    }

    /**
     * {@link #worker(BotState)} that never lets a failure end the loop: the bot is stopped instead
     * and waits for {@code /start}.
     */
    BotState safeWorker(BotState oldState) throws InterruptedException {
        try {
            return worker(oldState);
        } catch (RuntimeException e) {
            log.error("❌ Bot worker iteration failed. Stopping trader ...", e);
            stateHolder.set(BotState.STOPPED);
            sleep(STOPPED_SLEEP);
            return oldState;
        }
    }

    /**
     * One loop iteration.
     *
     * @return the state that was acted on, feed it back as {@code oldState}
     */
    public BotState worker(BotState oldState) throws InterruptedException {
        BotState state = stateHolder.get();
        if (state != oldState) {
            notificationService.send("*Status:* `" + state.name().toLowerCase() + "`");
            log.info("Changing state to: {}", state);
            if (state == BotState.RUNNING) {
                initialMessage();
            }
        }

        if (state == BotState.STOPPED) {
            sleep(STOPPED_SLEEP);
        } else {
            throttle(Duration.ofSeconds(properties.getInternals().getProcessThrottleSecs()));
        }
        return state;
    }

    /**
     * One tick.
     *
     * @return true if a trade was opened or closed
     */
    public boolean process() throws InterruptedException {
        boolean stateChanged = false;
        tickLock.lock();
        try {
            whitelistService.updateActiveWhitelist();

            List<Trade> trades = tradeService.getOpenTrades();
            for (Trade trade : trades) {
                stateChanged |= tradingService.processMaybeExecuteSell(trade);
            }

            if (properties.isDisableBuy()) {
                log.info("Buy disabled...");
            } else if (trades.size() < properties.getMaxOpenTrades()) {
                stateChanged |= tradingService.processMaybeExecuteBuy();
            }

            if (properties.getUnfilledTimeout().isConfigured() && !properties.isDryRun()) {
                orderUpdatesService.checkHandleTimedout(LocalDateTime.now(clock));
            }
        } catch (TemporaryException e) {
            log.warn("{}, retrying in {} seconds...", e.getMessage(), RETRY_TIMEOUT.toSeconds());
            sleep(RETRY_TIMEOUT);
        } catch (RuntimeException e) {
            // OperationalException and anything unexpected alike: stop, but keep the loop alive
            String name = e.getClass().getSimpleName();
            notificationService.send("*Status:* " + name + ":\n```\n" + stackTrace(e) + "```" + RESTART_HINT);
            log.error("{}. Stopping trader ...", name, e);
            stateHolder.set(BotState.STOPPED);
        } finally {
            tickLock.unlock();
        }
        return stateChanged;
    }

    /**
     * Runs {@code action} between two ticks, so it never races the loop on trade records.
     */
    public <T> T runExclusive(Supplier<T> action) {
        tickLock.lock();
        try {
            return action.get();
        } finally {
            tickLock.unlock();
        }
    }

    @PreDestroy
    public void cleanup() {
        log.info("Cleaning up modules ...");
        shutdown = true;
        notificationService.send("*Status:* `process stopped`");
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Bot worker did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    void initialMessage() {
        BotProperties.Experimental experimental = properties.getExperimental();
        boolean bookOrders = properties.getBidStrategy().isUseBookOrder() || properties.getAskStrategy().isUseBookOrder();

        if (properties.isDryRun()) {
            notificationService.send("*Warning:* `Paper trading is enabled. All trades are simulated.`");
            if (bookOrders) {
                notificationService.send("*Warning:* `Order book enabled in dry run. Results will be misleading.`");
            }
        }
        if (properties.isHighRiskTrading()) {
            notificationService.send("*Warning:* `High risk trading enabled. Profits will be re-traded.`");
        }

        StringBuilder summary = new StringBuilder()
                .append("*Exchange:* `").append(properties.getExchange().getName()).append("`\n")
                .append("*Stake per trade:* `").append(properties.getStakeAmount()).append(' ').append(properties.getStakeCurrency()).append("`\n")
                .append("*Minimum ROI:* `").append(strategyResolver.getMinimalRoi()).append("`\n")
                .append("*Ticker Interval:* `").append(strategyResolver.getTickerInterval().getValue()).append('`');
        if (experimental.isCheckDepthOfMarket()) {
            BigDecimal delta = experimental.getDomBidsAsksDelta();
            if (delta.compareTo(BigDecimal.ONE) > 0) {
                delta = delta.subtract(BigDecimal.ONE);
            }
            summary.append("\n*Pre Buy Check:* `DOM ")
                    .append(delta.multiply(BigDecimal.valueOf(100)).setScale(0, RoundingMode.HALF_EVEN).toPlainString())
                    .append("% buy to sell volume`");
        }
        if (experimental.isBuyPriceBelow24hHL()) {
            summary.append("\n*Pre Buy Check:* `Price below 24hour high and low`");
        }
        notificationService.send(summary.toString());

        String pairs;
        String specificPairs = "";
        if (properties.getDynamicWhitelist() > 0) {
            pairs = "top " + properties.getDynamicWhitelist();
        } else {
            pairs = "whitelisted";
            specificPairs = "\n" + String.join(", ", properties.getPairWhitelist());
        }
        notificationService.send("*Status:* `Searching for " + pairs + " " + properties.getStakeCurrency()
                + " pairs to buy and sell..." + specificPairs + "`");
    }

    private void throttle(Duration minDuration) throws InterruptedException {
        long start = System.nanoTime();
        process();
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        Duration rest = minDuration.minus(elapsed);
        if (!rest.isNegative()) {
            log.debug("Throttling process for {} ms", rest.toMillis());
            sleep(rest);
        }
    }

    protected void sleep(Duration duration) throws InterruptedException {
        Thread.sleep(duration.toMillis());
    }

    private static String stackTrace(Throwable e) {
        StringWriter writer = new StringWriter();
        e.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }
}
