package com.di.awardscope.filter;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * One filter chip as typed by the user. A chip containing {@code &&} is split into terms that
 * must all occur; terms match case-insensitively as substrings.
 *
 * @param label the trimmed chip text, as shown back to the user
 * @param terms lower-cased, non-blank terms
 */
public record ChipMatcher(String label, List<String> terms) {

    public static final String AND_SEPARATOR = "&&";

    public ChipMatcher {
        terms = List.copyOf(terms);
    }

    /** Parses a chip; returns {@code null} when nothing but blanks and separators remain. */
    public static ChipMatcher parse(String raw) {
        if (raw == null) return null;
        String label = raw.trim();
        List<String> terms = new ArrayList<>();
        for (String part : label.split(AND_SEPARATOR)) {
            String t = part.trim().toLowerCase(Locale.ROOT);
            if (!t.isEmpty()) terms.add(t);
        }
        return terms.isEmpty() ? null : new ChipMatcher(label, terms);
    }

    /** {@code lowerText} must already be lower-cased. */
    public boolean matchesLower(String lowerText) {
        if (lowerText == null) return false;
        for (String t : terms) {
            if (!lowerText.contains(t)) return false;
        }
        return true;
    }

    public boolean matches(String text) {
        return text != null && matchesLower(text.toLowerCase(Locale.ROOT));
    }
}
