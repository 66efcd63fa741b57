package com.deepansh.memory.store;

import java.util.Locale;

/**
 * Normalized text comparison used to decide redundancy: case, punctuation and
 * whitespace differences do not make a fact new.
 */
public final class ContentMatch {

    private ContentMatch() {}

    public static String normalize(String content) {
        if (content == null) return "";
        return content.toLowerCase(Locale.ROOT)
                .replaceAll("[\\p{Punct}&&[^%$]]", " ")
                .replaceAll("\\s+", " ")
                .trim();
    }

    public static boolean same(String a, String b) {
        return normalize(a).equals(normalize(b));
    }

    /** True when every word sequence of {@code part} already appears in {@code whole}. */
    public static boolean contains(String whole, String part) {
        String p = normalize(part);
        return !p.isEmpty() && normalize(whole).contains(p);
    }

    /** Joins detail onto existing content the way appended memories read: "a. b". */
    public static String append(String existing, String addition) {
        String base = existing == null ? "" : existing.strip();
        if (base.endsWith(".")) base = base.substring(0, base.length() - 1);
        return base.isEmpty() ? addition.strip() : base + ". " + addition.strip();
    }
}
