package io.spotbot.configs.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Bot settings bound from the {@code bot.*} section of application.yml.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "bot")
public class BotProperties {

    private int botId = 0;
    private String initialState = "STOPPED";
    private boolean dryRun = true;
    private BigDecimal dryRunWallet = new BigDecimal("999.9");

    private String stakeCurrency = "USDT";
    private BigDecimal stakeAmount = new BigDecimal("50");
    private String fiatDisplayCurrency = "USD";
    private int maxOpenTrades = 3;
    private boolean highRiskTrading = false;
    private boolean disableBuy = false;

    // top-N pairs by quote volume, 0 = use pairWhitelist as is
    private int dynamicWhitelist = 0;
    private List<String> pairWhitelist = new ArrayList<>();
    private List<String> pairBlacklist = new ArrayList<>();

    private String strategy = "emaCrossStrategy";
    private String tickerInterval;
    private BigDecimal stoploss;
    private LinkedHashMap<Integer, BigDecimal> minimalRoi;

    private TrailingStop trailingStop = new TrailingStop();
    private UnfilledTimeout unfilledTimeout = new UnfilledTimeout();
    private BidStrategy bidStrategy = new BidStrategy();
    private AskStrategy askStrategy = new AskStrategy();
    private Experimental experimental = new Experimental();
    private Internals internals = new Internals();
    private Notification notification = new Notification();
    private Exchange exchange = new Exchange();

    @Getter
    @Setter
    public static class TrailingStop {
        private boolean enabled = false;
        // stoploss used instead of the strategy one while the trade is in profit
        private BigDecimal positive;
    }

    @Getter
    @Setter
    public static class UnfilledTimeout {
        // minutes, null disables the timeout sweep
        private Integer buy;
        private Integer sell;

        public boolean isConfigured() {
            return buy != null && sell != null;
        }
    }

    @Getter
    @Setter
    public static class BidStrategy {
        private BigDecimal askLastBalance = BigDecimal.ZERO;
        private boolean useBookOrder = false;
        private int bookOrderTop = 1;
        private BigDecimal percentFromTop = BigDecimal.ZERO;
    }

    @Getter
    @Setter
    public static class AskStrategy {
        private boolean useBookOrder = false;
        private int bookOrderMin = 1;
        private int bookOrderMax = 1;
    }

    @Getter
    @Setter
    public static class Experimental {
        private boolean useSellSignal = false;
        private boolean sellProfitOnly = false;
        private boolean sellFullfilledAtRoi = false;
        private boolean checkDepthOfMarket = false;
        private BigDecimal domBidsAsksDelta = BigDecimal.ZERO;
        private boolean buyPriceBelow24hHL = false;
    }

    @Getter
    @Setter
    public static class Internals {
        private int processThrottleSecs = 5;
    }

    @Getter
    @Setter
    public static class Notification {
        private boolean enabled = false;
        private String webhookUrl = "";
    }

    @Getter
    @Setter
    public static class Exchange {
        private String name = "binance";
        private BigDecimal makerFee = new BigDecimal("0.001");
        private BigDecimal takerFee = new BigDecimal("0.001");
    }
}
