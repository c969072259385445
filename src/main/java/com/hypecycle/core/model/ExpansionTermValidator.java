package com.hypecycle.core.model;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Filters LLM-proposed search terms down to the ones worth re-querying collectors with.
 * <p>
 * A term is kept when it is non-blank, at most {@link #MAX_TERM_LENGTH} characters,
 * not a generic word such as "technology", not the keyword itself and not a
 * duplicate of an earlier term. Keyword and duplicate checks compare letters and digits
 * only, so "Plant-Cell-Culture" matches "plant cell culture", and a plural formed with
 * a trailing "s" or "es" counts as the keyword. At most {@link #MAX_TERMS} terms survive.
 */
public final class ExpansionTermValidator {

    public static final int MIN_TERMS = 3;
    public static final int MAX_TERMS = 5;
    public static final int MAX_TERM_LENGTH = 60;

    static final Set<String> GENERIC_TERMS = Set.of(
            "technology", "technologies", "tech", "system", "systems", "innovation",
            "solution", "solutions", "platform", "software", "application", "applications",
            "method", "process", "research", "development", "science", "industry", "product");

    private ExpansionTermValidator() {}

    public static List<String> validTerms(String keyword, List<String> candidates) {
        if (candidates == null) {
            return List.of();
        }
        String foldedKeyword = fold(keyword);
        Set<String> seen = new HashSet<>();
        List<String> kept = new ArrayList<>();
        for (String candidate : candidates) {
            if (kept.size() == MAX_TERMS) {
                break;
            }
            if (!isUsable(foldedKeyword, candidate)) {
                continue;
            }
            if (seen.add(fold(candidate))) {
                kept.add(candidate.trim());
            }
        }
        return List.copyOf(kept);
    }

    static boolean isUsable(String foldedKeyword, String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return false;
        }
        String normalized = normalize(candidate);
        String folded = fold(candidate);
        return normalized.length() <= MAX_TERM_LENGTH
                && !folded.isEmpty()
                && !GENERIC_TERMS.contains(normalized)
                && !isInflectionOf(folded, foldedKeyword);
    }

    /** True when one side equals the other, or the other plus "s" or "es". */
    static boolean isInflectionOf(String folded, String foldedKeyword) {
        return folded.equals(foldedKeyword)
                || folded.equals(foldedKeyword + "s") || folded.equals(foldedKeyword + "es")
                || foldedKeyword.equals(folded + "s") || foldedKeyword.equals(folded + "es");
    }

    /** Lower-cased letters and digits only. */
    static String fold(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder folded = new StringBuilder(value.length());
        value.toLowerCase(Locale.ROOT).codePoints()
                .filter(Character::isLetterOrDigit)
                .forEach(folded::appendCodePoint);
        return folded.toString();
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
