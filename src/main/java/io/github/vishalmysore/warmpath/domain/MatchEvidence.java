package io.github.vishalmysore.warmpath.domain;

import lombok.Value;

/**
 * One field-level comparison backing a match, kept for audit and review.
 */
@Value(staticConstructor = "of")
public class MatchEvidence {
    String field;
    String targetValue;
    String candidateValue;
    double similarity;
}
