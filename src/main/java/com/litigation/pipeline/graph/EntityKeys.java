package com.litigation.pipeline.graph;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Derives the normalized name key used for canonical entity identity.
 */
public final class EntityKeys {

    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");

    private EntityKeys() {
    }

    /**
     * Lower-cases, strips accents and collapses every run of punctuation or whitespace to
     * a single underscore. {@code "Acme Corp."} and {@code "ACME  corp"} share the key
     * {@code acme_corp}.
     */
    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        String decomposed = Normalizer.normalize(name, Normalizer.Form.NFD);
        String stripped = DIACRITICS.matcher(decomposed).replaceAll("");
        String key = NON_ALNUM.matcher(stripped.toLowerCase(Locale.ROOT)).replaceAll("_");
        int start = 0;
        int end = key.length();
        while (start < end && key.charAt(start) == '_') {
            start++;
        }
        while (end > start && key.charAt(end - 1) == '_') {
            end--;
        }
        return key.substring(start, end);
    }
}
