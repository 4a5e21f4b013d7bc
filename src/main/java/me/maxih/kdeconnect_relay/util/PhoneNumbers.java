package me.maxih.kdeconnect_relay.util;

/**
 * Loose phone number comparison for numbers as phones report them ("+1 (555) 123-4567",
 * "5551234567", "020 7946 0018", ...).
 * <p>
 * {@link #matches} is reflexive and symmetric but not transitive. Only ever compare two
 * numbers directly, never group numbers into classes through a third one.
 */
public class PhoneNumbers {
    private static final int US_NATIONAL_LENGTH = 10;
    private static final int SUFFIX_LENGTH = 7;

    public static String normalize(String phone) {
        if (phone == null) return "";
        StringBuilder digits = new StringBuilder(phone.length());
        for (int i = 0; i < phone.length(); i++) {
            char c = phone.charAt(i);
            if (c >= '0' && c <= '9') digits.append(c);
        }
        return digits.toString();
    }

    public static boolean matches(String phone1, String phone2) {
        String norm1 = normalize(phone1);
        String norm2 = normalize(phone2);

        if (norm1.equals(norm2)) return true;

        if (isUsCountryCodeOf(norm1, norm2) || isUsCountryCodeOf(norm2, norm1)) return true;

        return norm1.length() >= SUFFIX_LENGTH && norm2.length() >= SUFFIX_LENGTH
                && norm1.regionMatches(norm1.length() - SUFFIX_LENGTH, norm2, norm2.length() - SUFFIX_LENGTH, SUFFIX_LENGTH);
    }

    // "1" + national number
    private static boolean isUsCountryCodeOf(String withCode, String national) {
        return national.length() == US_NATIONAL_LENGTH
                && withCode.length() == US_NATIONAL_LENGTH + 1
                && withCode.charAt(0) == '1'
                && withCode.endsWith(national);
    }
}
