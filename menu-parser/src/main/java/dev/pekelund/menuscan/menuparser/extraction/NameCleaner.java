package dev.pekelund.menuscan.menuparser.extraction;

import java.util.regex.Pattern;

/**
 * Turns a captured name fragment into a display name.
 *
 * <p>Trailing quantity or size numbers ("Naan 2", "Pepsi 500") are kept as part of the name; they are
 * shown to the reviewer instead of being silently discarded.</p>
 */
public final class NameCleaner {

    private static final Pattern LIST_MARKER = Pattern.compile("^(?:[-*•·]+|\\d{1,3}[.)])\\s+");
    private static final Pattern LEADING_FILL = Pattern.compile("^[\\s.…·:|\u2013\u2014_-]+");
    private static final Pattern TRAILING_FILL = Pattern.compile("[\\s.…·:|\u2013\u2014_$₹€£¥-]+$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private NameCleaner() {
    }

    public static String clean(String value) {
        if (value == null) {
            return "";
        }
        String cleaned = WHITESPACE.matcher(value.replace('\u00A0', ' ').trim()).replaceAll(" ");
        cleaned = LIST_MARKER.matcher(cleaned).replaceFirst("");
        cleaned = LEADING_FILL.matcher(cleaned).replaceFirst("");
        cleaned = TRAILING_FILL.matcher(cleaned).replaceFirst("");
        return cleaned.trim();
    }
}
