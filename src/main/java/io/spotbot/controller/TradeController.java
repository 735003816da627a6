package io.spotbot.controller;

import io.spotbot.configs.properties.BotProperties;
import io.spotbot.notification.FiatConvertService;
import io.spotbot.trade.dto.ProfitDto;
import io.spotbot.trade.model.Trade;
import io.spotbot.trade.service.TradeService;
import io.spotbot.trading.TradingService;
import io.spotbot.trading.stake.StakeService;
import io.spotbot.worker.BotWorker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@CrossOrigin(origins = "*")
@Slf4j
@RestController
@RequestMapping("/trades")
@RequiredArgsConstructor
public class TradeController {
    private final TradeService tradeService;
    private final TradingService tradingService;
    private final StakeService stakeService;
    private final FiatConvertService fiatConvertService;
    private final BotWorker botWorker;
    private final BotProperties properties;

    @GetMapping("/open")
    @ResponseStatus(HttpStatus.OK)
    public List<Trade> getOpenTrades() {
        return tradeService.getOpenTrades();
    }

    @GetMapping("/{id}")
    @ResponseStatus(HttpStatus.OK)
    public Trade getTrade(@PathVariable String id) {
        return tradeService.getById(id);
    }

    @GetMapping("/profit")
    @ResponseStatus(HttpStatus.OK)
    public ProfitDto getProfit() {
        StakeService.ProfitsFees profitsFees = stakeService.getTradeProfitsFees();
        return ProfitDto.builder()
                .stakeCurrency(properties.getStakeCurrency())
                .closedProfit(profitsFees.profit())
                .closedProfitFiat(fiatConvertService.convertAmount(profitsFees.profit(),
                        properties.getStakeCurrency(), properties.getFiatDisplayCurrency()))
                .fiatCurrency(properties.getFiatDisplayCurrency())
                .meanOpenFee(profitsFees.meanFee())
                .closedTrades(profitsFees.tradeCount())
                .build();
    }

    @PostMapping("/{id}/forcesell")
    @ResponseStatus(HttpStatus.OK)
    public Trade forceSell(@PathVariable String id) {
        log.info("Force sell requested for trade {}", id);
        return botWorker.runExclusive(() -> tradingService.forceSell(id));
    }
}
