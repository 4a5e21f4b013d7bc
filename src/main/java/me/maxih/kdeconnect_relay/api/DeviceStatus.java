package me.maxih.kdeconnect_relay.api;

public record DeviceStatus(
        Integer batteryLevel,
        Boolean charging,
        Integer signalStrength,
        String networkType
) {
    public static DeviceStatus battery(int level, boolean charging) {
        return new DeviceStatus(level, charging, null, null);
    }

    public static DeviceStatus connectivity(int signalStrength, String networkType) {
        return new DeviceStatus(null, null, signalStrength, networkType);
    }

    public boolean isEmpty() {
        return batteryLevel == null && charging == null && signalStrength == null && networkType == null;
    }
}
