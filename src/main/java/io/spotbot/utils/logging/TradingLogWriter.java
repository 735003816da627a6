package io.spotbot.utils.logging;

import io.spotbot.helpers.SymbolHelper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Decision journal, one file per pair and day: {@code logs/trading/btcusdt_2024-01-31.log}.
 */
@Slf4j
@Component
public class TradingLogWriter {
    private static final String LOGS_DIR = "logs/trading";
    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm:ss.SSS");

    private final Clock clock;
    private final String logsDir;
    private final ConcurrentHashMap<String, ReentrantLock> fileLocks = new ConcurrentHashMap<>();

    @Autowired
    public TradingLogWriter(Clock clock) {
        this(clock, LOGS_DIR);
    }

    TradingLogWriter(Clock clock, String logsDir) {
        this.clock = clock;
        this.logsDir = logsDir;
        createLogsDirectory();
    }

    private void createLogsDirectory() {
        File dir = new File(logsDir);
        if (!dir.exists() && !dir.mkdirs()) {
            log.error("Failed to create trading logs directory: {}", logsDir);
        }
    }

    public void write(String pair, String event, String details) {
        LocalDateTime now = LocalDateTime.now(clock);
        String fileName = getLogFileName(pair, now);
        ReentrantLock lock = fileLocks.computeIfAbsent(fileName, k -> new ReentrantLock());

        lock.lock();
        try (PrintWriter writer = new PrintWriter(new FileWriter(fileName, true))) {
            writer.printf("[%s] %-14s %s%n", now.format(TIME_FORMATTER), event, details);
        } catch (IOException e) {
            log.error("Failed to write trade log for {}: {}", pair, e.getMessage());
        } finally {
            lock.unlock();
        }
    }

    String getLogFileName(String pair, LocalDateTime now) {
        return String.format("%s/%s_%s.log", logsDir, SymbolHelper.toSymbol(pair).toLowerCase(), now.format(DATE_FORMATTER));
    }
}
