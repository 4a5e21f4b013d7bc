package me.maxih.kdeconnect_relay.api;

import java.util.List;
import java.util.Objects;

public sealed interface SmsProtocolEvent
        permits SmsProtocolEvent.MessageReceived,
                SmsProtocolEvent.ConversationsReceived,
                SmsProtocolEvent.Error {

    record MessageReceived(SmsMessage message) implements SmsProtocolEvent {
        public MessageReceived {
            Objects.requireNonNull(message, "message");
        }
    }

    record ConversationsReceived(List<SmsConversation> conversations) implements SmsProtocolEvent {
        public ConversationsReceived {
            conversations = List.copyOf(conversations);
        }
    }

    record Error(String message) implements SmsProtocolEvent {
    }
}
