package me.maxih.kdeconnect_relay.util;

import java.time.Duration;
import java.time.Instant;

public class SmsText {

    public static String relativeTime(long timestampMillis, Instant now) {
        long diff = now.getEpochSecond() - timestampMillis / 1000;
        if (diff < 60) return "Just now";
        if (diff < Duration.ofHours(1).toSeconds()) return diff / 60 + " min ago";
        if (diff < Duration.ofDays(1).toSeconds()) return diff / 3600 + " hours ago";
        if (diff < Duration.ofDays(7).toSeconds()) return diff / 86400 + " days ago";
        return "More than a week ago";
    }

    public static String truncate(String text, int maxLength) {
        if (text == null) return "";
        if (text.length() <= maxLength) return text;
        int end = maxLength;
        // keep surrogate pairs together
        if (end > 0 && Character.isHighSurrogate(text.charAt(end - 1))) end--;
        return text.substring(0, end) + "...";
    }
}
