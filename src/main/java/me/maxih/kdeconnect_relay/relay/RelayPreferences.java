package me.maxih.kdeconnect_relay.relay;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.prefs.Preferences;

public class RelayPreferences {
    private static final Logger logger = LoggerFactory.getLogger(RelayPreferences.class);
    private static final Preferences PREFERENCES = Preferences.userNodeForPackage(RelayContext.class);

    static final long DEFAULT_BURST_WINDOW_MILLIS = 10_000;
    static final long DEFAULT_BURST_INTERVAL_MILLIS = 500;
    static final long DEFAULT_BACKSTOP_INTERVAL_MILLIS = 30_000;
    static final long DEFAULT_SEND_RECONCILE_WINDOW_MILLIS = 120_000;
    static final String DEFAULT_PING_MESSAGE = "Ping from COSMIC!";
    static final String DEFAULT_RING_MESSAGE = "findmyphone:ring";

    public record Settings(
            Duration burstWindow,
            Duration burstInterval,
            Duration backstopInterval,
            Duration sendReconcileWindow,
            String pingMessage,
            String ringMessage
    ) {
        public Settings {
            requirePositive(burstWindow, "burstWindow");
            requirePositive(burstInterval, "burstInterval");
            requirePositive(backstopInterval, "backstopInterval");
            requirePositive(sendReconcileWindow, "sendReconcileWindow");
            if (pingMessage == null) pingMessage = DEFAULT_PING_MESSAGE;
            if (ringMessage == null || ringMessage.equals(pingMessage)) ringMessage = DEFAULT_RING_MESSAGE;
        }

        public static Settings defaults() {
            return new Settings(
                    Duration.ofMillis(DEFAULT_BURST_WINDOW_MILLIS),
                    Duration.ofMillis(DEFAULT_BURST_INTERVAL_MILLIS),
                    Duration.ofMillis(DEFAULT_BACKSTOP_INTERVAL_MILLIS),
                    Duration.ofMillis(DEFAULT_SEND_RECONCILE_WINDOW_MILLIS),
                    DEFAULT_PING_MESSAGE,
                    DEFAULT_RING_MESSAGE
            );
        }

        private static void requirePositive(Duration duration, String name) {
            if (duration == null || duration.isNegative() || duration.isZero()) {
                throw new IllegalArgumentException(name + " must be a positive duration");
            }
        }
    }

    public static Duration getBurstWindow() {
        return Duration.ofMillis(PREFERENCES.getLong("BurstWindowMillis", DEFAULT_BURST_WINDOW_MILLIS));
    }

    public static Duration getBurstInterval() {
        return Duration.ofMillis(PREFERENCES.getLong("BurstIntervalMillis", DEFAULT_BURST_INTERVAL_MILLIS));
    }

    public static Duration getBackstopInterval() {
        return Duration.ofMillis(PREFERENCES.getLong("BackstopIntervalMillis", DEFAULT_BACKSTOP_INTERVAL_MILLIS));
    }

    public static Duration getSendReconcileWindow() {
        return Duration.ofMillis(PREFERENCES.getLong("SendReconcileWindowMillis", DEFAULT_SEND_RECONCILE_WINDOW_MILLIS));
    }

    public static String getPingMessage() {
        return PREFERENCES.get("PingMessage", DEFAULT_PING_MESSAGE);
    }

    public static String getRingMessage() {
        return PREFERENCES.get("RingMessage", DEFAULT_RING_MESSAGE);
    }

    public static Settings load() {
        try {
            return new Settings(getBurstWindow(), getBurstInterval(), getBackstopInterval(),
                    getSendReconcileWindow(), getPingMessage(), getRingMessage());
        } catch (IllegalArgumentException e) {
            logger.warn("Ignoring stored relay preferences: {}", e.getMessage());
            return Settings.defaults();
        }
    }
}
