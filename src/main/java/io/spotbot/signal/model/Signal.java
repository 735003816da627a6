package io.spotbot.signal.model;

import lombok.Value;

@Value
public class Signal {
    public static final Signal NONE = new Signal(false, false);

    boolean buy;
    boolean sell;
}
