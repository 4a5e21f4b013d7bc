package me.maxih.kdeconnect_relay.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class VCardParser {

    public record Card(Optional<String> name, List<String> phoneNumbers) {
        public Card {
            phoneNumbers = List.copyOf(phoneNumbers);
        }
    }

    public static Card parse(String content) {
        String name = null;
        List<String> phones = new ArrayList<>();
        if (content == null) return new Card(Optional.empty(), phones);

        for (String rawLine : content.split("\\R")) {
            String line = rawLine.trim();

            if (line.startsWith("FN:")) {
                String formatted = line.substring(3).trim();
                if (!formatted.isEmpty()) name = formatted;
            } else if (name == null && line.startsWith("N:")) {
                // Family;Given;Middle;Prefix;Suffix
                String[] parts = line.substring(2).split(";", -1);
                if (parts.length >= 2) {
                    String fullName = (parts[1].trim() + " " + parts[0].trim()).trim();
                    if (!fullName.isEmpty()) name = fullName;
                }
            } else if (line.startsWith("TEL")) {
                int colon = line.lastIndexOf(':');
                if (colon >= 0) {
                    String phone = line.substring(colon + 1).trim();
                    if (!phone.isEmpty()) phones.add(phone);
                }
            }
        }

        return new Card(Optional.ofNullable(name), phones);
    }
}
