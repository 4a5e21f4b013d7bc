package me.maxih.kdeconnect_relay.api;

import java.util.Comparator;
import java.util.Objects;

public record SmsConversation(
        String threadId,
        String phoneNumber,
        String contactName,
        String lastMessage,
        long timestamp,
        boolean unread
) {
    public static final Comparator<SmsConversation> NEWEST_FIRST =
            Comparator.comparingLong(SmsConversation::timestamp).reversed();

    public SmsConversation {
        Objects.requireNonNull(threadId, "threadId");
        phoneNumber = phoneNumber == null ? "" : phoneNumber;
        contactName = contactName == null || contactName.isBlank() ? phoneNumber : contactName;
        lastMessage = lastMessage == null ? "" : lastMessage;
    }

    public SmsConversation withContactName(String name) {
        return new SmsConversation(threadId, phoneNumber, name, lastMessage, timestamp, unread);
    }

    public SmsConversation withLastMessage(String message, long newTimestamp) {
        return new SmsConversation(threadId, phoneNumber, contactName, message, newTimestamp, unread);
    }

    // Summary fields come from incoming, the phone number stays the first one seen.
    public SmsConversation mergedWith(SmsConversation incoming) {
        return new SmsConversation(threadId, phoneNumber, incoming.contactName,
                incoming.lastMessage, incoming.timestamp, incoming.unread);
    }
}
