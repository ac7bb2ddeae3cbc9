package com.chirpy.api.chirps;

import java.util.List;

/**
 * Masks a fixed list of words. Matching is a literal substring match on the
 * capitalized and the lowercase spelling only.
 */
final class ProfanityFilter {

    private static final List<String> WORDS = List.of("Kerfuffle", "Sharbert", "Fornax");
    private static final String MASK = "****";

    static String clean(String text) {
        String result = text;
        for (String word : WORDS) {
            result = result.replace(word, MASK).replace(word.toLowerCase(), MASK);
        }
        return result;
    }

    private ProfanityFilter() {}
}
