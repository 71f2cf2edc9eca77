package io.github.vishalmysore.warmpath.similarity;

/**
 * Strategy interface for comparing two short strings such as person names
 * or organization names. The entity resolver thresholds are calibrated for
 * {@link LevenshteinSimilarityProvider}.
 */
public interface SimilarityProvider {

    /**
     * Compute similarity between two strings.
     *
     * @return a score between 0.0 (nothing in common) and 1.0 (identical)
     */
    double computeSimilarity(String textA, String textB);

    /**
     * Descriptive name of this provider (for logging/reporting).
     */
    String getName();
}
