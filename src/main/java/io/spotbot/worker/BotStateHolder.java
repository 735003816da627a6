package io.spotbot.worker;

import io.spotbot.configs.properties.BotProperties;
import io.spotbot.worker.enums.BotState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Running / stopped flag of the control loop. Read between ticks, written by the loop itself
 * (on fatal errors) and by the REST controls.
 */
@Slf4j
@Component
public class BotStateHolder {
    private volatile BotState state;

    public BotStateHolder(BotProperties properties) {
        this.state = BotState.fromString(properties.getInitialState());
    }

    public BotState get() {
        return state;
    }

    public void set(BotState state) {
        if (this.state != state) {
            log.info("Bot state requested: {} -> {}", this.state, state);
        }
        this.state = state;
    }
}
