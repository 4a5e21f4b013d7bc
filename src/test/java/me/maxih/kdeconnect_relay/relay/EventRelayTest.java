package me.maxih.kdeconnect_relay.relay;

import me.maxih.kdeconnect_relay.api.CoreCommand;
import me.maxih.kdeconnect_relay.api.CoreEvent;
import me.maxih.kdeconnect_relay.api.Device;
import me.maxih.kdeconnect_relay.api.DeviceId;
import me.maxih.kdeconnect_relay.api.DeviceStatus;
import me.maxih.kdeconnect_relay.api.DeviceType;
import me.maxih.kdeconnect_relay.api.PairState;
import me.maxih.kdeconnect_relay.api.SmsProtocolEvent;
import me.maxih.kdeconnect_relay.sms.SmsReconciler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class EventRelayTest {
    private static final DeviceId DEV1 = DeviceId.of("dev1");

    private MutableClock clock;
    private DeviceCache cache;
    private SmsReconciler sms;
    private EventRelay relay;
    private RecordingListener listener;
    private final List<CoreCommand> sent = new ArrayList<>();

    private static class RecordingListener implements RelayListener {
        int devicesChanged;
        final List<PairingNotification> pairingRequests = new ArrayList<>();
        final List<String> clipboard = new ArrayList<>();
        final List<DeviceStatus> statuses = new ArrayList<>();
        final List<String> mpris = new ArrayList<>();

        @Override
        public void onDevicesChanged() {
            devicesChanged++;
        }

        @Override
        public void onPairingRequest(PairingNotification notification) {
            pairingRequests.add(notification);
        }

        @Override
        public void onClipboardReceived(String content) {
            clipboard.add(content);
        }

        @Override
        public void onStateUpdated(DeviceId deviceId, DeviceStatus status) {
            statuses.add(status);
        }

        @Override
        public void onMpris(DeviceId deviceId, String payload) {
            mpris.add(payload);
        }
    }

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.ofEpochSecond(1_700_000_000L));
        cache = new DeviceCache();
        CommandDispatcher dispatcher = new CommandDispatcher(Runnable::run, "ping", "ring");
        dispatcher.attach(sent::add);
        sms = new SmsReconciler(dispatcher, clock, Duration.ofMinutes(2));
        relay = new EventRelay(cache, new PairingNotifier(cache), new PairingBurstWindow(clock, Duration.ofSeconds(10)), sms);
        listener = new RecordingListener();
        relay.addListener(listener);
    }

    private static Device device(String id, String name, PairState state) {
        return Device.of(DeviceId.of(id), name, DeviceType.PHONE, state, Set.of());
    }

    private void apply(CoreEvent event) {
        assertTrue(relay.process(new RelayInput.Core(event)));
    }

    @Test
    void process_connectedThenDisconnected() {
        apply(new CoreEvent.Connected(DEV1, device("dev1", "Pixel", PairState.PAIRED)));

        List<Device> devices = cache.getAll();
        assertEquals(1, devices.size());
        assertEquals("Pixel", devices.get(0).name());
        assertEquals(PairState.PAIRED, devices.get(0).pairState());
        assertTrue(devices.get(0).reachable());

        apply(new CoreEvent.Disconnected(DEV1));

        assertTrue(cache.getAll().isEmpty());
        assertEquals(2, listener.devicesChanged);
    }

    @Test
    void process_disconnectOfUnknownDevice() {
        apply(new CoreEvent.Disconnected(DEV1));

        assertEquals(0, listener.devicesChanged);
    }

    @Test
    void process_cacheHoldsExactlyTheConnectedDevices() {
        Random random = new Random(42);
        Set<DeviceId> expected = new HashSet<>();

        for (int i = 0; i < 500; i++) {
            String id = "dev" + random.nextInt(6);
            DeviceId deviceId = DeviceId.of(id);
            switch (random.nextInt(3)) {
                case 0 -> {
                    apply(new CoreEvent.Connected(deviceId, device(id, id, PairState.NOT_PAIRED)));
                    expected.add(deviceId);
                }
                case 1 -> {
                    apply(new CoreEvent.DevicePaired(deviceId, device(id, id, PairState.NOT_PAIRED)));
                    expected.add(deviceId);
                }
                default -> {
                    apply(new CoreEvent.Disconnected(deviceId));
                    expected.remove(deviceId);
                }
            }

            Set<DeviceId> actual = cache.getAll().stream().map(Device::id).collect(Collectors.toSet());
            assertEquals(expected, actual);
        }
    }

    @Test
    void process_devicePairedMarksPaired() {
        apply(new CoreEvent.Connected(DEV1, device("dev1", "Pixel", PairState.REQUESTED)));
        apply(new CoreEvent.DevicePaired(DEV1, device("dev1", "Pixel", PairState.REQUESTED)));

        assertTrue(cache.get(DEV1).orElseThrow().isPaired());
    }

    @Test
    void process_pairingRequestNotifiedOnce() {
        apply(new CoreEvent.Connected(DEV1, device("dev1", "Pixel", PairState.NOT_PAIRED)));
        apply(new CoreEvent.PairStateChanged(DEV1, PairState.REQUESTED));
        apply(new CoreEvent.PairStateChanged(DEV1, PairState.REQUESTED));

        assertEquals(1, listener.pairingRequests.size());
        assertEquals("Pixel", listener.pairingRequests.get(0).deviceName());
    }

    @Test
    void process_pairingRequestFromUnknownDevice() {
        apply(new CoreEvent.PairStateChanged(DEV1, PairState.REQUESTED));

        assertTrue(listener.pairingRequests.isEmpty());
        assertTrue(cache.getAll().isEmpty());
    }

    @Test
    void process_pairStateChangeUpdatesCache() {
        apply(new CoreEvent.Connected(DEV1, device("dev1", "Pixel", PairState.PAIRED)));
        apply(new CoreEvent.PairStateChanged(DEV1, PairState.NOT_PAIRED));

        assertEquals(PairState.NOT_PAIRED, cache.get(DEV1).orElseThrow().pairState());
    }

    @Test
    void process_unexpectedPairStateChangeStillApplied() {
        apply(new CoreEvent.Connected(DEV1, device("dev1", "Pixel", PairState.NOT_PAIRED)));
        apply(new CoreEvent.PairStateChanged(DEV1, PairState.PAIRED));

        assertEquals(PairState.PAIRED, cache.get(DEV1).orElseThrow().pairState());
    }

    @Test
    void process_stateUpdateMergedIntoCache() {
        apply(new CoreEvent.Connected(DEV1, device("dev1", "Pixel", PairState.PAIRED)));
        apply(new CoreEvent.StateUpdated(DEV1, DeviceStatus.battery(80, false)));
        apply(new CoreEvent.StateUpdated(DEV1, DeviceStatus.connectivity(2, "LTE")));

        Device device = cache.get(DEV1).orElseThrow();
        assertEquals(80, device.batteryLevel());
        assertEquals(2, device.signalStrength());
        assertEquals(2, listener.statuses.size());
    }

    @Test
    void process_stateUpdateForUnknownDevice() {
        apply(new CoreEvent.StateUpdated(DEV1, DeviceStatus.battery(80, false)));

        assertTrue(cache.getAll().isEmpty());
        assertTrue(listener.statuses.isEmpty());
    }

    @Test
    void process_clipboardAndMprisForwarded() {
        apply(new CoreEvent.ClipboardReceived("copied text"));
        apply(new CoreEvent.Mpris(DEV1, "playing"));

        assertEquals(List.of("copied text"), listener.clipboard);
        assertEquals(List.of("playing"), listener.mpris);
    }

    @Test
    void process_smsPacketRoutedToReconciler() {
        List<SmsProtocolEvent> events = new ArrayList<>();
        sms.addListener(events::add);
        sms.open(DEV1);

        apply(new CoreEvent.SmsMessages(DEV1,
                "{\"messages\":[{\"id\":\"a\",\"thread_id\":\"7\",\"body\":\"hi\",\"date\":100}]}"));

        assertEquals(1, sms.conversations().size());
        assertTrue(events.get(0) instanceof SmsProtocolEvent.MessageReceived);
    }

    @Test
    void process_burstTicksOnlyInsideWindow() {
        assertTrue(relay.process(new RelayInput.BurstTick()));
        assertEquals(0, listener.devicesChanged);

        apply(new CoreEvent.Connected(DEV1, device("dev1", "Pixel", PairState.PAIRED)));
        int afterConnect = listener.devicesChanged;

        clock.advance(Duration.ofSeconds(5));
        relay.process(new RelayInput.BurstTick());
        assertEquals(afterConnect + 1, listener.devicesChanged);

        clock.advance(Duration.ofSeconds(5));
        relay.process(new RelayInput.BurstTick());
        assertEquals(afterConnect + 1, listener.devicesChanged);
    }

    @Test
    void process_backstopTickAlwaysRefreshes() {
        relay.process(new RelayInput.BackstopTick());
        assertEquals(1, listener.devicesChanged);
        assertTrue(sent.isEmpty());

        sms.open(DEV1);
        sent.clear();
        relay.process(new RelayInput.BackstopTick());

        assertEquals(2, listener.devicesChanged);
        assertEquals(List.of(new CoreCommand.RequestConversations(DEV1)), sent);
    }

    @Test
    void process_endOfStreamStopsLoop() {
        assertFalse(relay.process(new RelayInput.EndOfStream()));
    }

    @Test
    void process_failingListenerDoesNotStopOthers() {
        relay.addListener(new RelayListener() {
            @Override
            public void onDevicesChanged() {
                throw new IllegalStateException("listener bug");
            }
        });
        RecordingListener second = new RecordingListener();
        relay.addListener(second);

        apply(new CoreEvent.Connected(DEV1, device("dev1", "Pixel", PairState.PAIRED)));

        assertEquals(1, second.devicesChanged);
        assertEquals(1, cache.size());
    }

    @Test
    void start_drainsSourceUntilEndOfStream() throws InterruptedException {
        Iterator<CoreEvent> events = List.<CoreEvent>of(
                new CoreEvent.Connected(DEV1, device("dev1", "Pixel", PairState.PAIRED)),
                new CoreEvent.Connected(DeviceId.of("dev2"), device("dev2", "Tab", PairState.NOT_PAIRED)),
                new CoreEvent.Disconnected(DEV1)
        ).iterator();

        relay.start(() -> events.hasNext() ? Optional.of(events.next()) : Optional.empty());

        assertTrue(relay.awaitStopped(5, TimeUnit.SECONDS));
        assertEquals(List.of(DeviceId.of("dev2")), cache.getAll().stream().map(Device::id).toList());
    }

    @Test
    void process_pairingFlowRemembersRequestedState() {
        apply(new CoreEvent.Connected(DEV1, device("dev1", "Pixel", PairState.NOT_PAIRED)));
        apply(new CoreEvent.PairStateChanged(DEV1, PairState.REQUESTED));

        Device cached = cache.get(DEV1).orElseThrow();
        assertEquals(PairState.NOT_PAIRED, cached.pairState());
        assertEquals(PairState.REQUESTED, relay.lastKnownPairState(DEV1, cached));
        assertTrue(relay.lastKnownPairState(DEV1, cached).canTransitionTo(PairState.PAIRED));

        apply(new CoreEvent.PairStateChanged(DEV1, PairState.PAIRED));

        cached = cache.get(DEV1).orElseThrow();
        assertEquals(PairState.PAIRED, cached.pairState());
        assertEquals(PairState.PAIRED, relay.lastKnownPairState(DEV1, cached));
    }
}
