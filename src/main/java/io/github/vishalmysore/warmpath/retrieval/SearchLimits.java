package io.github.vishalmysore.warmpath.retrieval;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Bounds of one multi-path search. Depth and edge pruning are part of the
 * search contract; the expansion count and deadline are optional budgets an
 * orchestrator can impose for responsiveness.
 */
@Value
@Builder
public class SearchLimits {
    @Builder.Default
    int maxHops = 3;

    // Edges below this weight are never expanded
    @Builder.Default
    double minEdgeWeight = 0.0;

    // 0 means unlimited
    @Builder.Default
    int maxExpansions = 0;

    Instant deadline;

    public static SearchLimits ofHops(int maxHops) {
        return SearchLimits.builder().maxHops(maxHops).build();
    }
}
