package com.eryxon.gateway.domain.naming;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns free-form hierarchy names ("Laser Cutting", "Acme Co.") into topic-safe segments.
 * Output only contains {@code [a-z0-9_-]}, so normalizing twice gives the same result as once.
 */
public final class TopicNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern UNSAFE = Pattern.compile("[^a-z0-9_-]");

    private TopicNormalizer() {
    }

    /**
     * Lowercases the value, collapses whitespace runs into one underscore and strips every
     * character outside {@code [a-z0-9_-]}.
     *
     * @param value the raw value, may be null
     * @return the normalized segment, empty for null input
     */
    public static String normalize(String value) {
        if (value == null) {
            return "";
        }
        String lower = value.toLowerCase(Locale.ROOT);
        String underscored = WHITESPACE.matcher(lower).replaceAll("_");
        return UNSAFE.matcher(underscored).replaceAll("");
    }
}
