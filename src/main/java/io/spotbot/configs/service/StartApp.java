package io.spotbot.configs.service;

import io.spotbot.worker.BotWorker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class StartApp implements ApplicationRunner {
    private final BotWorker botWorker;

    @Override
    public void run(ApplicationArguments args) {
        log.info("✅ call -> botWorker.start()");
        botWorker.start();
    }
}
