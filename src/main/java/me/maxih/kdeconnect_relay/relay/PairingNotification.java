package me.maxih.kdeconnect_relay.relay;

import me.maxih.kdeconnect_relay.api.DeviceId;
import me.maxih.kdeconnect_relay.api.DeviceType;

import java.util.Objects;

public record PairingNotification(DeviceId deviceId, String deviceName, DeviceType deviceType) {
    public PairingNotification {
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(deviceName, "deviceName");
        Objects.requireNonNull(deviceType, "deviceType");
    }

    public String summary() {
        return deviceName + " wants to pair";
    }
}
