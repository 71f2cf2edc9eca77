package io.github.vishalmysore.warmpath.similarity;

import java.util.Locale;

/**
 * Normalized edit-distance similarity: {@code 1 - distance / maxLength}
 * computed on the lower-cased, trimmed inputs.
 *
 * "Alice Smith" vs "alice smith " → 1.0 (identical after normalization)
 * "Alice Smith" vs "Alice Smyth" → ~0.91 (one substitution in eleven)
 *
 * Blank or null input never matches anything, including another blank.
 */
public class LevenshteinSimilarityProvider implements SimilarityProvider {

    @Override
    public double computeSimilarity(String textA, String textB) {
        if (textA == null || textB == null)
            return 0.0;

        String a = normalize(textA);
        String b = normalize(textB);

        if (a.isEmpty() || b.isEmpty())
            return 0.0;
        if (a.equals(b))
            return 1.0;

        int distance = editDistance(a, b);
        return 1.0 - (double) distance / Math.max(a.length(), b.length());
    }

    private String normalize(String text) {
        return text.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Classic Levenshtein distance (unit cost insert, delete, substitute),
     * keeping only two rows of the matrix.
     */
    int editDistance(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }

        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    @Override
    public String getName() {
        return "Levenshtein (normalized edit distance)";
    }
}
