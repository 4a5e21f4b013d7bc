package me.maxih.kdeconnect_relay.api;

public class CoreUnavailableException extends Exception {
    public CoreUnavailableException(String message) {
        super(message);
    }

    public CoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
