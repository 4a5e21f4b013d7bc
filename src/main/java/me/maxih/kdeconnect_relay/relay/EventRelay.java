package me.maxih.kdeconnect_relay.relay;

import me.maxih.kdeconnect_relay.api.CoreEvent;
import me.maxih.kdeconnect_relay.api.CoreEventSource;
import me.maxih.kdeconnect_relay.api.Device;
import me.maxih.kdeconnect_relay.api.DeviceId;
import me.maxih.kdeconnect_relay.api.PairState;
import me.maxih.kdeconnect_relay.sms.SmsReconciler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Applies Core events and refresh ticks to the device cache, one at a time and in arrival
 * order, and tells the listeners about the outcome.
 */
public class EventRelay {
    private static final Logger logger = LoggerFactory.getLogger(EventRelay.class);

    private final DeviceCache cache;
    private final PairingNotifier notifier;
    private final PairingBurstWindow burstWindow;
    private final SmsReconciler sms;
    private final List<RelayListener> listeners = new CopyOnWriteArrayList<>();
    private final BlockingQueue<RelayInput> queue = new LinkedBlockingQueue<>();
    private final CountDownLatch stopped = new CountDownLatch(1);

    private Thread pumpThread;
    private Thread loopThread;

    public EventRelay(DeviceCache cache, PairingNotifier notifier, PairingBurstWindow burstWindow, SmsReconciler sms) {
        this.cache = cache;
        this.notifier = notifier;
        this.burstWindow = burstWindow;
        this.sms = sms;
    }

    public void addListener(RelayListener listener) {
        listeners.add(listener);
    }

    public void removeListener(RelayListener listener) {
        listeners.remove(listener);
    }

    void enqueue(RelayInput input) {
        if (stopped.getCount() == 0) {
            logger.trace("Relay stopped, dropping {}", input);
            return;
        }
        queue.add(input);
    }

    int pendingInputs() {
        return queue.size();
    }

    /**
     * Starts pulling events from {@code source}. The pump blocks on the source while the
     * loop thread drains the queue, so a slow listener never stalls the Core.
     */
    public synchronized void start(CoreEventSource source) {
        if (loopThread != null) throw new IllegalStateException("Relay already started");

        pumpThread = new Thread(() -> pump(source), "kdeconnect-core-pump");
        pumpThread.setDaemon(true);
        loopThread = new Thread(this::runLoop, "kdeconnect-relay");
        loopThread.setDaemon(true);

        loopThread.start();
        pumpThread.start();
        logger.info("Event relay started");
    }

    public synchronized void stop() {
        if (pumpThread != null) pumpThread.interrupt();
        if (loopThread != null) loopThread.interrupt();
    }

    /** Waits until the loop has exited, either after the end of the stream or {@link #stop()}. */
    public boolean awaitStopped(long timeout, TimeUnit unit) throws InterruptedException {
        return stopped.await(timeout, unit);
    }

    private void pump(CoreEventSource source) {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                Optional<CoreEvent> event = source.next();
                if (event.isEmpty()) {
                    logger.info("Core event stream ended");
                    break;
                }
                enqueue(new RelayInput.Core(event.get()));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        } catch (RuntimeException e) {
            logger.error("Core event source failed", e);
        }
        enqueue(new RelayInput.EndOfStream());
    }

    private void runLoop() {
        try {
            while (true) {
                RelayInput input = queue.take();
                if (!process(input)) break;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            stopped.countDown();
            queue.clear();
            logger.info("Event relay stopped");
        }
    }

    /**
     * Applies a single input.
     *
     * @return {@code false} once the loop should stop
     */
    boolean process(RelayInput input) {
        if (input instanceof RelayInput.Core core) {
            try {
                apply(core.event());
            } catch (RuntimeException e) {
                logger.error("Failed to apply {}", core.event().getClass().getSimpleName(), e);
            }
        } else if (input instanceof RelayInput.BurstTick) {
            if (burstWindow.isOpen()) devicesChanged();
        } else if (input instanceof RelayInput.BackstopTick) {
            devicesChanged();
            sms.reloadConversations();
        } else if (input instanceof RelayInput.EndOfStream) {
            return false;
        }
        return true;
    }

    private void apply(CoreEvent event) {
        if (event instanceof CoreEvent.Connected connected) {
            cache.upsert(connected.device().withReachable(true));
            logger.info("Device connected: {}", connected.deviceId());
            burstWindow.restart();
            devicesChanged();
        } else if (event instanceof CoreEvent.DevicePaired paired) {
            cache.upsert(paired.device().withPairState(PairState.PAIRED).withReachable(true));
            notifier.onPaired(paired.deviceId());
            logger.info("Device paired: {}", paired.deviceId());
            burstWindow.restart();
            devicesChanged();
        } else if (event instanceof CoreEvent.Disconnected disconnected) {
            notifier.forget(disconnected.deviceId());
            if (cache.remove(disconnected.deviceId())) {
                logger.info("Device disconnected: {}", disconnected.deviceId());
                devicesChanged();
            } else {
                logger.debug("Disconnect for unknown device {}", disconnected.deviceId());
            }
        } else if (event instanceof CoreEvent.PairStateChanged change) {
            onPairStateChanged(change.deviceId(), change.pairState());
        } else if (event instanceof CoreEvent.StateUpdated update) {
            Optional<Device> device = cache.get(update.deviceId());
            if (device.isEmpty()) {
                logger.debug("State update for unknown device {}", update.deviceId());
                return;
            }
            cache.upsert(device.get().withStatus(update.status()));
            devicesChanged();
            notifyListeners(l -> l.onStateUpdated(update.deviceId(), update.status()));
        } else if (event instanceof CoreEvent.ClipboardReceived clipboard) {
            notifyListeners(l -> l.onClipboardReceived(clipboard.content()));
        } else if (event instanceof CoreEvent.Mpris mpris) {
            notifyListeners(l -> l.onMpris(mpris.deviceId(), mpris.payload()));
        } else if (event instanceof CoreEvent.SmsMessages messages) {
            sms.ingestPacket(messages.deviceId(), messages.json());
        }
    }

    private void onPairStateChanged(DeviceId id, PairState state) {
        Optional<Device> device = cache.get(id);
        if (device.isPresent() && state != PairState.REQUESTED) {
            PairState previous = lastKnownPairState(id, device.get());
            if (!previous.canTransitionTo(state)) {
                logger.warn("Unexpected pair state change for {}: {} -> {}", id, previous, state);
            }
            if (device.get().pairState() != state) {
                cache.upsert(device.get().withPairState(state));
                devicesChanged();
            }
        }

        notifier.onPairStateChanged(id, state)
                .ifPresent(notification -> notifyListeners(l -> l.onPairingRequest(notification)));
    }

    // REQUESTED is never cached, the notifier still remembers it
    PairState lastKnownPairState(DeviceId id, Device cached) {
        return notifier.lastSeen(id)
                .filter(state -> state == PairState.REQUESTED)
                .orElse(cached.pairState());
    }

    private void devicesChanged() {
        notifyListeners(RelayListener::onDevicesChanged);
    }

    private void notifyListeners(Consumer<RelayListener> call) {
        for (RelayListener listener : listeners) {
            try {
                call.accept(listener);
            } catch (RuntimeException e) {
                logger.warn("Relay listener failed", e);
            }
        }
    }
}
