package io.github.vishalmysore.warmpath.domain;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * A scored path with its 1-based rank and a human-readable rationale.
 */
@Value
@Builder
public class RankedPath {
    IntroPath path;
    double score;
    int rank;

    @With
    @Builder.Default
    String explanation = "";
}
