package com.rcassist.infrastructure.ai.parsing;

import java.text.Normalizer;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns headings into stable section keys: {@code "## Root Cause (Most Likely)"} becomes
 * {@code root_cause_most_likely}.
 */
public final class SectionKeyNormalizer {

    static final String FALLBACK_KEY = "section";

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private SectionKeyNormalizer() {
    }

    public static String normalize(String heading) {
        if (heading == null) {
            return FALLBACK_KEY;
        }
        String result = Normalizer.normalize(heading, Normalizer.Form.NFC).toLowerCase(Locale.ROOT);
        // markdown emphasis and punctuation become word breaks
        result = NON_WORD.matcher(result).replaceAll(" ").strip();
        result = WHITESPACE.matcher(result).replaceAll("_");
        return result.isEmpty() ? FALLBACK_KEY : result;
    }

    /**
     * Returns {@code key}, or {@code key_2}, {@code key_3}, ... when already taken, and records
     * the returned key as used.
     */
    public static String unique(String key, Set<String> used) {
        String candidate = key;
        int suffix = 2;
        while (!used.add(candidate)) {
            candidate = key + "_" + suffix++;
        }
        return candidate;
    }
}
