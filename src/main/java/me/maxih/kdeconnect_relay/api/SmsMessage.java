package me.maxih.kdeconnect_relay.api;

import java.util.Objects;

public record SmsMessage(
        String id,
        String threadId,
        String body,
        String address,
        long date,
        Direction direction,
        boolean read
) {
    public static final int TYPE_RECEIVED = 1;
    public static final int TYPE_SENT = 2;

    public enum Direction {
        RECEIVED, SENT;

        public static Direction fromMessageType(int messageType) {
            return messageType == TYPE_SENT ? SENT : RECEIVED;
        }
    }

    public SmsMessage {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(threadId, "threadId");
        body = body == null ? "" : body;
        address = address == null ? "" : address;
        direction = direction == null ? Direction.RECEIVED : direction;
    }

    public boolean isSent() {
        return direction == Direction.SENT;
    }
}
