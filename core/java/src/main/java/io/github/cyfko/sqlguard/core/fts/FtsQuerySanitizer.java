package io.github.cyfko.sqlguard.core.fts;

import java.util.StringJoiner;

/**
 * Turns free user text into a safe prefix-match query for a full-text index.
 * <p>
 * Characters with meaning in the match language ({@code ( ) * " : ^ - + ~ & |}) are removed,
 * the rest is split on Unicode whitespace and every token gets a trailing {@code *}.
 * </p>
 * <pre>{@code
 * buildFtsQuery("sodium (chloride)*");  // "sodium* chloride*"
 * buildFtsQuery("a+b-c");               // "abc*"
 * buildFtsQuery("   ");                 // ""
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FtsQuerySanitizer {

    private static final String SPECIAL = "()*\":^-+~&|";

    private FtsQuerySanitizer() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @param text raw search text, may be {@code null}
     * @return the sanitized query, empty when nothing searchable remains
     */
    public static String buildFtsQuery(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder cleaned = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (SPECIAL.indexOf(c) < 0) {
                cleaned.append(c);
            }
        }

        StringJoiner query = new StringJoiner(" ");
        for (String token : cleaned.toString().split("(?U)\\s+")) {
            if (!token.isEmpty()) {
                query.add(token + "*");
            }
        }
        return query.toString();
    }
}
