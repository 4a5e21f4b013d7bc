package me.maxih.kdeconnect_relay.api;

import java.util.Objects;

public record DeviceId(String value) {
    public DeviceId {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) throw new IllegalArgumentException("Device id must not be blank");
    }

    public static DeviceId of(String value) {
        return new DeviceId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
