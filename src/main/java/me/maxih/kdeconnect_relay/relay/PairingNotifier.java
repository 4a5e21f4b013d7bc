package me.maxih.kdeconnect_relay.relay;

import me.maxih.kdeconnect_relay.api.Device;
import me.maxih.kdeconnect_relay.api.DeviceId;
import me.maxih.kdeconnect_relay.api.PairState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Decides when a pair state change becomes a user-visible pairing request.
 * <p>
 * The Core re-sends pairing packets, so a device that is already {@code REQUESTED} does
 * not notify again until it has left that state. Only the relay thread calls this class.
 */
public class PairingNotifier {
    private static final Logger logger = LoggerFactory.getLogger(PairingNotifier.class);

    private final DeviceCache cache;
    private final Map<DeviceId, PairState> lastNotified = new HashMap<>();

    public PairingNotifier(DeviceCache cache) {
        this.cache = cache;
    }

    public Optional<PairingNotification> onPairStateChanged(DeviceId id, PairState state) {
        if (state != PairState.REQUESTED) {
            lastNotified.put(id, state);
            return Optional.empty();
        }

        if (lastNotified.get(id) == PairState.REQUESTED) {
            logger.debug("Pairing request from {} already notified", id);
            return Optional.empty();
        }

        Optional<Device> device = cache.get(id);
        if (device.isEmpty()) {
            logger.debug("Dropping pairing request from unknown device {}", id);
            return Optional.empty();
        }

        lastNotified.put(id, PairState.REQUESTED);
        Device d = device.get();
        logger.info("Pairing request from {} ({})", d.name(), d.type().key());
        return Optional.of(new PairingNotification(id, d.name(), d.type()));
    }

    public Optional<PairState> lastSeen(DeviceId id) {
        return Optional.ofNullable(lastNotified.get(id));
    }

    public void onPaired(DeviceId id) {
        lastNotified.put(id, PairState.PAIRED);
    }

    public void forget(DeviceId id) {
        lastNotified.remove(id);
    }
}
