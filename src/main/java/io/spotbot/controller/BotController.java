package io.spotbot.controller;

import io.spotbot.trade.service.TradeService;
import io.spotbot.trading.whitelist.WhitelistService;
import io.spotbot.worker.BotStateHolder;
import io.spotbot.worker.enums.BotState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@CrossOrigin(origins = "*")
@Slf4j
@RestController
@RequestMapping("/bot")
@RequiredArgsConstructor
public class BotController {
    private final BotStateHolder stateHolder;
    private final TradeService tradeService;
    private final WhitelistService whitelistService;

    @GetMapping("/status")
    @ResponseStatus(HttpStatus.OK)
    public Map<String, Object> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("state", stateHolder.get());
        body.put("openTrades", tradeService.countOpenTrades());
        return body;
    }

    @PostMapping("/start")
    @ResponseStatus(HttpStatus.OK)
    public Map<String, Object> start() {
        log.info("▶ Start requested via REST");
        stateHolder.set(BotState.RUNNING);
        return Map.of("state", stateHolder.get());
    }

    @PostMapping("/stop")
    @ResponseStatus(HttpStatus.OK)
    public Map<String, Object> stop() {
        log.info("⏸ Stop requested via REST");
        stateHolder.set(BotState.STOPPED);
        return Map.of("state", stateHolder.get());
    }

    @GetMapping("/whitelist")
    @ResponseStatus(HttpStatus.OK)
    public List<String> whitelist() {
        return whitelistService.getActiveWhitelist();
    }
}
