package me.maxih.kdeconnect_relay.api;

public class MalformedPayloadException extends Exception {
    public MalformedPayloadException(String message) {
        super(message);
    }

    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
