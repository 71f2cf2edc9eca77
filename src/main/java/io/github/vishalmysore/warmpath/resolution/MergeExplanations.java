package io.github.vishalmysore.warmpath.resolution;

import io.github.vishalmysore.warmpath.domain.EntityResolutionMatch;

import java.util.stream.Collectors;

/**
 * Audit-trail wording for a resolution match, stored alongside a merge.
 */
public final class MergeExplanations {

    private MergeExplanations() {
    }

    /**
     * For example {@code "Exact email address match. Confidence: 100%. Evidence: email: 100%"}.
     */
    public static String explain(EntityResolutionMatch match) {
        String evidence = match.getEvidence().stream()
                .map(e -> e.getField() + ": " + percent(e.getSimilarity()))
                .collect(Collectors.joining(", "));
        return match.getMatchMethod().getDescription() + ". Confidence: " + percent(match.getMatchScore())
                + ". Evidence: " + evidence;
    }

    private static String percent(double value) {
        return Math.round(value * 100) + "%";
    }
}
