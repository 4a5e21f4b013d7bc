package me.maxih.kdeconnect_relay.api;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

public record Device(
        DeviceId id,
        String name,
        DeviceType type,
        PairState pairState,
        boolean reachable,
        Set<Capability> capabilities,
        Integer batteryLevel,
        Boolean charging,
        Integer signalStrength,
        String networkType
) {
    public Device {
        Objects.requireNonNull(id, "id");
        name = name == null || name.isBlank() ? id.value() : name;
        type = type == null ? DeviceType.UNKNOWN : type;
        pairState = pairState == null ? PairState.NOT_PAIRED : pairState;
        capabilities = capabilities == null || capabilities.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(capabilities));
        if (batteryLevel != null && (batteryLevel < 0 || batteryLevel > 100)) {
            throw new IllegalArgumentException("Battery level out of range: " + batteryLevel);
        }
        if (signalStrength != null && (signalStrength < -1 || signalStrength > 4)) {
            throw new IllegalArgumentException("Signal strength out of range: " + signalStrength);
        }
    }

    public static Device of(DeviceId id, String name, DeviceType type, PairState pairState, Set<Capability> capabilities) {
        return new Device(id, name, type, pairState, true, capabilities, null, null, null, null);
    }

    public boolean isPaired() {
        return pairState == PairState.PAIRED;
    }

    public boolean has(Capability capability) {
        return capabilities.contains(capability);
    }

    public Device withPairState(PairState newState) {
        return new Device(id, name, type, newState, reachable, capabilities,
                batteryLevel, charging, signalStrength, networkType);
    }

    public Device withReachable(boolean newReachable) {
        return new Device(id, name, type, pairState, newReachable, capabilities,
                batteryLevel, charging, signalStrength, networkType);
    }

    public Device withStatus(DeviceStatus status) {
        if (status == null || status.isEmpty()) return this;
        return new Device(id, name, type, pairState, reachable, capabilities,
                status.batteryLevel() != null ? status.batteryLevel() : batteryLevel,
                status.charging() != null ? status.charging() : charging,
                status.signalStrength() != null ? status.signalStrength() : signalStrength,
                status.networkType() != null ? status.networkType() : networkType);
    }

    public String batteryIconName() {
        if (batteryLevel == null || charging == null) return "battery-symbolic";
        if (charging) return "battery-full-charging-symbolic";
        if (batteryLevel <= 20) return "battery-level-20-symbolic";
        if (batteryLevel <= 40) return "battery-level-40-symbolic";
        if (batteryLevel <= 60) return "battery-level-60-symbolic";
        if (batteryLevel <= 80) return "battery-level-80-symbolic";
        return "battery-level-100-symbolic";
    }

    public String signalIconName() {
        if (signalStrength == null) return null;
        return switch (signalStrength) {
            case -1 -> "network-cellular-offline-symbolic";
            case 0 -> "network-cellular-signal-none-symbolic";
            case 1 -> "network-cellular-signal-weak-symbolic";
            case 2 -> "network-cellular-signal-ok-symbolic";
            case 3 -> "network-cellular-signal-good-symbolic";
            default -> "network-cellular-signal-excellent-symbolic";
        };
    }
}
