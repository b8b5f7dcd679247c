package com.farmket.marketplace.util;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns human readable names into URL-safe slugs.
 * <p>
 * Accents are folded to ASCII, anything that is not a word character, whitespace or hyphen is
 * dropped, and runs of whitespace/hyphens become a single hyphen. "Fresh Apples &amp; Pears!"
 * becomes {@code fresh-apples-pears}.
 */
public final class Slugs {

    private static final Pattern NON_ASCII = Pattern.compile("[^\\x00-\\x7F]");
    private static final Pattern NON_SLUG_CHARS = Pattern.compile("[^\\w\\s-]");
    private static final Pattern SEPARATOR_RUNS = Pattern.compile("[-\\s]+");
    private static final Pattern EDGE_SEPARATORS = Pattern.compile("^[-_]+|[-_]+$");

    private Slugs() {
    }

    public static String slugify(String value) {
        if (value == null) {
            return "";
        }
        String ascii = NON_ASCII.matcher(Normalizer.normalize(value, Normalizer.Form.NFKD)).replaceAll("");
        String cleaned = NON_SLUG_CHARS.matcher(ascii.toLowerCase(Locale.ROOT)).replaceAll("");
        String hyphenated = SEPARATOR_RUNS.matcher(cleaned.trim()).replaceAll("-");
        return EDGE_SEPARATORS.matcher(hyphenated).replaceAll("");
    }

    public static boolean isBlank(String slug) {
        return slug == null || slug.isEmpty();
    }
}
