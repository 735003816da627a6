package io.spotbot.signal;

import io.spotbot.klines.enums.IntervalE;
import io.spotbot.klines.model.KlineModel;
import io.spotbot.signal.model.Signal;
import io.spotbot.strategy.model.AnalyzedCandle;

import java.util.List;

public interface SignalService {
    /**
     * Buy / sell flags of the latest closed candle. Never throws for bad or stale data,
     * those yield {@link Signal#NONE}.
     */
    Signal getSignal(String pair, IntervalE interval);

    List<AnalyzedCandle> analyzeTicker(List<KlineModel> klines, String pair);

    List<AnalyzedCandle> parseTickerHistory(List<KlineModel> klines);
}
