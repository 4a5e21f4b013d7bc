package me.maxih.kdeconnect_relay.sms;

import me.maxih.kdeconnect_relay.util.PhoneNumbers;
import me.maxih.kdeconnect_relay.util.VCardParser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Phone number to display name lookups. Immutable; a fresh batch of contacts replaces
 * the whole directory.
 */
public final class ContactDirectory {
    private static final ContactDirectory EMPTY = new ContactDirectory(Map.of());

    public record Contact(String phoneNumber, String name) {
    }

    private final Map<String, String> names;

    private ContactDirectory(Map<String, String> names) {
        this.names = names;
    }

    public static ContactDirectory empty() {
        return EMPTY;
    }

    public static ContactDirectory of(Map<String, String> phoneToName) {
        Map<String, String> copy = new LinkedHashMap<>();
        phoneToName.forEach((phone, name) -> {
            if (phone != null && !phone.isBlank() && name != null && !name.isBlank()) {
                copy.put(phone, name);
            }
        });
        return new ContactDirectory(Collections.unmodifiableMap(copy));
    }

    /** Builds a directory from vCards; cards without a name or number are skipped. */
    public static ContactDirectory fromVCards(List<String> vcards) {
        Map<String, String> phoneToName = new LinkedHashMap<>();
        for (String vcard : vcards) {
            VCardParser.Card card = VCardParser.parse(vcard);
            if (card.name().isEmpty()) continue;
            for (String phone : card.phoneNumbers()) {
                phoneToName.putIfAbsent(phone, card.name().get());
            }
        }
        return of(phoneToName);
    }

    public int size() {
        return names.size();
    }

    public boolean isEmpty() {
        return names.isEmpty();
    }

    public Map<String, String> asMap() {
        return names;
    }

    /** First contact whose number matches {@code phoneNumber}. */
    public Optional<String> nameFor(String phoneNumber) {
        for (Map.Entry<String, String> entry : names.entrySet()) {
            if (PhoneNumbers.matches(phoneNumber, entry.getKey())) return Optional.of(entry.getValue());
        }
        return Optional.empty();
    }

    /**
     * Interprets what the user typed as a recipient: an exact contact name, then a contact
     * name containing the input, otherwise the input itself as a number.
     */
    public String resolveRecipient(String input) {
        String trimmed = input.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (lower.isEmpty()) return trimmed;

        for (Map.Entry<String, String> entry : names.entrySet()) {
            if (entry.getValue().toLowerCase(Locale.ROOT).equals(lower)) return entry.getKey();
        }
        for (Map.Entry<String, String> entry : names.entrySet()) {
            if (entry.getValue().toLowerCase(Locale.ROOT).contains(lower)) return entry.getKey();
        }
        return trimmed;
    }

    /** Contacts sorted by name, narrowed down by name, raw number or digits. */
    public List<Contact> suggest(String input) {
        String term = input == null ? "" : input.trim().toLowerCase(Locale.ROOT);
        String digits = PhoneNumbers.normalize(term);

        List<Contact> result = new ArrayList<>();
        for (Map.Entry<String, String> entry : names.entrySet()) {
            String phone = entry.getKey();
            String name = entry.getValue();
            boolean include = term.isEmpty()
                    || name.toLowerCase(Locale.ROOT).contains(term)
                    || phone.contains(term)
                    || (!digits.isEmpty() && PhoneNumbers.normalize(phone).contains(digits));
            if (include) result.add(new Contact(phone, name));
        }
        result.sort(Comparator.comparing(Contact::name));
        return result;
    }
}
