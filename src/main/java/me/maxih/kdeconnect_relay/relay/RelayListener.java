package me.maxih.kdeconnect_relay.relay;

import me.maxih.kdeconnect_relay.api.DeviceId;
import me.maxih.kdeconnect_relay.api.DeviceStatus;

// Called on the relay thread.
public interface RelayListener {

    default void onDevicesChanged() {
    }

    default void onPairingRequest(PairingNotification notification) {
    }

    default void onClipboardReceived(String content) {
    }

    default void onStateUpdated(DeviceId deviceId, DeviceStatus status) {
    }

    default void onMpris(DeviceId deviceId, String payload) {
    }
}
