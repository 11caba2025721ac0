package com.foreman.core.persistence;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Generates session ids of the form {@code yyyyMMdd_HHmmss_SSS_NN} from the creation
 * time (UTC). Ids sort in creation order and are strictly increasing within a process,
 * even when the clock stands still or steps backwards.
 */
public class SessionIdGenerator {

    private static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS").withZone(ZoneOffset.UTC);

    private final Clock clock;
    private long lastMillis = Long.MIN_VALUE;
    private int sequence;

    public SessionIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public synchronized String next() {
        long now = clock.millis();
        if (now > lastMillis) {
            lastMillis = now;
            sequence = 0;
        } else if (++sequence > 99) {
            lastMillis++;
            sequence = 0;
        }
        return FORMAT.format(Instant.ofEpochMilli(lastMillis)) + String.format("_%02d", sequence);
    }
}
