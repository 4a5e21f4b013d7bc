package me.maxih.kdeconnect_relay.api;

import java.util.Objects;

public sealed interface CoreEvent
        permits CoreEvent.Connected,
                CoreEvent.DevicePaired,
                CoreEvent.Disconnected,
                CoreEvent.PairStateChanged,
                CoreEvent.ClipboardReceived,
                CoreEvent.StateUpdated,
                CoreEvent.Mpris,
                CoreEvent.SmsMessages {

    record Connected(DeviceId deviceId, Device device) implements CoreEvent {
        public Connected {
            Objects.requireNonNull(deviceId, "deviceId");
            Objects.requireNonNull(device, "device");
            requireSameDevice(deviceId, device);
        }
    }

    record DevicePaired(DeviceId deviceId, Device device) implements CoreEvent {
        public DevicePaired {
            Objects.requireNonNull(deviceId, "deviceId");
            Objects.requireNonNull(device, "device");
            requireSameDevice(deviceId, device);
        }
    }

    record Disconnected(DeviceId deviceId) implements CoreEvent {
        public Disconnected {
            Objects.requireNonNull(deviceId, "deviceId");
        }
    }

    record PairStateChanged(DeviceId deviceId, PairState pairState) implements CoreEvent {
        public PairStateChanged {
            Objects.requireNonNull(deviceId, "deviceId");
            Objects.requireNonNull(pairState, "pairState");
        }
    }

    record ClipboardReceived(String content) implements CoreEvent {
        public ClipboardReceived {
            content = content == null ? "" : content;
        }
    }

    record StateUpdated(DeviceId deviceId, DeviceStatus status) implements CoreEvent {
        public StateUpdated {
            Objects.requireNonNull(deviceId, "deviceId");
            Objects.requireNonNull(status, "status");
        }
    }

    record Mpris(DeviceId deviceId, String payload) implements CoreEvent {
        public Mpris {
            Objects.requireNonNull(deviceId, "deviceId");
        }
    }

    record SmsMessages(DeviceId deviceId, String json) implements CoreEvent {
        public SmsMessages {
            Objects.requireNonNull(deviceId, "deviceId");
        }
    }

    private static void requireSameDevice(DeviceId deviceId, Device device) {
        if (!deviceId.equals(device.id())) {
            throw new IllegalArgumentException("Event for " + deviceId + " carries device " + device.id());
        }
    }
}
