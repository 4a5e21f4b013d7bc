package me.maxih.kdeconnect_relay.api;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the body of a {@code kdeconnect.sms.messages} packet into {@link SmsMessage}s.
 * A packet is accepted or rejected as a whole: one bad entry rejects the batch.
 */
public final class SmsPacketParser {

    public static List<SmsMessage> parse(String json) throws MalformedPayloadException {
        if (json == null || json.isBlank()) {
            throw new MalformedPayloadException("Empty SMS packet");
        }

        JsonElement root;
        try {
            root = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new MalformedPayloadException("SMS packet is not valid JSON", e);
        }

        if (!root.isJsonObject()) {
            throw new MalformedPayloadException("SMS packet is not a JSON object");
        }
        JsonElement messagesElement = root.getAsJsonObject().get("messages");
        if (messagesElement == null || !messagesElement.isJsonArray()) {
            throw new MalformedPayloadException("SMS packet has no messages array");
        }

        JsonArray array = messagesElement.getAsJsonArray();
        List<SmsMessage> messages = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            JsonElement entry = array.get(i);
            if (!entry.isJsonObject()) {
                throw new MalformedPayloadException("SMS entry " + i + " is not an object");
            }
            messages.add(toMessage(entry.getAsJsonObject(), i));
        }
        return messages;
    }

    private static SmsMessage toMessage(JsonObject entry, int index) throws MalformedPayloadException {
        String id = requiredString(entry, "id", index);
        String threadId = requiredString(entry, "thread_id", index);

        try {
            return new SmsMessage(
                    id,
                    threadId,
                    optionalString(entry, "body"),
                    firstAddress(entry),
                    entry.has("date") ? entry.get("date").getAsLong() : 0L,
                    SmsMessage.Direction.fromMessageType(
                            entry.has("message_type") ? entry.get("message_type").getAsInt() : SmsMessage.TYPE_RECEIVED),
                    readFlag(entry.get("read"))
            );
        } catch (ClassCastException | IllegalStateException | UnsupportedOperationException | NumberFormatException e) {
            throw new MalformedPayloadException("SMS entry " + index + " has a field of the wrong type", e);
        }
    }

    private static String requiredString(JsonObject entry, String key, int index) throws MalformedPayloadException {
        JsonElement value = entry.get(key);
        if (value == null || !value.isJsonPrimitive()) {
            throw new MalformedPayloadException("SMS entry " + index + " is missing '" + key + "'");
        }
        String text = value.getAsString();
        if (text.isEmpty()) {
            throw new MalformedPayloadException("SMS entry " + index + " has an empty '" + key + "'");
        }
        return text;
    }

    private static String optionalString(JsonObject entry, String key) {
        JsonElement value = entry.get(key);
        if (value == null || value.isJsonNull()) return "";
        return value.getAsString();
    }

    private static String firstAddress(JsonObject entry) {
        JsonElement addresses = entry.get("addresses");
        if (addresses == null || !addresses.isJsonArray()) return "";
        for (JsonElement address : addresses.getAsJsonArray()) {
            if (address.isJsonObject() && address.getAsJsonObject().has("address")) {
                return address.getAsJsonObject().get("address").getAsString();
            }
        }
        return "";
    }

    private static boolean readFlag(JsonElement value) {
        if (value == null || value.isJsonNull()) return false;
        JsonPrimitive primitive = value.getAsJsonPrimitive();
        if (primitive.isBoolean()) return primitive.getAsBoolean();
        return primitive.getAsInt() == 1;
    }

    private SmsPacketParser() {}
}
