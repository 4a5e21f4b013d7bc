package me.maxih.kdeconnect_relay.api;

import java.util.Locale;

public enum DeviceType {
    PHONE("phone", "phone-symbolic"),
    TABLET("tablet", "tablet-symbolic"),
    DESKTOP("desktop", "computer-symbolic"),
    LAPTOP("laptop", "computer-symbolic"),
    TV("tv", "video-display-symbolic"),
    UNKNOWN("unknown", "phone-symbolic");

    private final String key;
    private final String iconName;

    DeviceType(String key, String iconName) {
        this.key = key;
        this.iconName = iconName;
    }

    public String key() {
        return key;
    }

    public String iconName() {
        return iconName;
    }

    public static DeviceType fromKey(String key) {
        if (key == null) return UNKNOWN;
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (DeviceType type : values()) {
            if (type.key.equals(normalized)) return type;
        }
        return UNKNOWN;
    }
}
