package domain.format;

import java.util.Locale;

/**
 * Casing applied to every emitted keyword token. Identifiers and literals are never touched.
 */
public enum KeywordCase {
    UPPER,
    LOWER;

    public String apply(String keyword) {
        if (keyword == null) return "";
        return this == UPPER ? keyword.toUpperCase(Locale.ROOT) : keyword.toLowerCase(Locale.ROOT);
    }

    /** Lenient parse: "lower" (any case) yields LOWER, anything else UPPER. */
    public static KeywordCase parse(String s) {
        if (s != null && s.trim().equalsIgnoreCase("lower")) return LOWER;
        return UPPER;
    }
}
