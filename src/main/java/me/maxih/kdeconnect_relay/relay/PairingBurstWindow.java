package me.maxih.kdeconnect_relay.relay;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

public class PairingBurstWindow {
    private final Clock clock;
    private final Duration length;
    private Instant startedAt;

    public PairingBurstWindow(Clock clock, Duration length) {
        this.clock = clock;
        this.length = length;
    }

    public synchronized void restart() {
        startedAt = clock.instant();
    }

    public synchronized boolean isOpen() {
        if (startedAt == null) return false;
        Duration elapsed = Duration.between(startedAt, clock.instant());
        return !elapsed.isNegative() && elapsed.compareTo(length) < 0;
    }

    public synchronized Duration elapsed() {
        if (startedAt == null) return Duration.ZERO;
        return Duration.between(startedAt, clock.instant());
    }
}
