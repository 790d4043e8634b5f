package org.kumeo.dsl.ast;

import java.util.Arrays;
import java.util.Optional;

/**
 * Built-in event transports for sources and targets.
 */
public enum TransportKind {
    NATS("NATS", true),
    HTTP("HTTP", true),
    KAFKA("Kafka", true),
    MQTT("MQTT", true),
    TIMER("Timer", false),
    FILE("File", true);

    private final String tag;
    private final boolean targetCapable;

    TransportKind(String tag, boolean targetCapable) {
        this.tag = tag;
        this.targetCapable = targetCapable;
    }

    public String tag() {
        return tag;
    }

    /**
     * Whether events can be emitted to this transport. Timers only produce events.
     */
    public boolean isTargetCapable() {
        return targetCapable;
    }

    public static Optional<TransportKind> fromTag(String tag) {
        return Arrays.stream(values())
                     .filter(kind -> kind.tag.equals(tag))
                     .findFirst();
    }
}
