package io.github.vishalmysore.warmpath.retrieval;

import io.github.vishalmysore.warmpath.domain.IntroPath;
import io.github.vishalmysore.warmpath.domain.RankedPath;
import io.github.vishalmysore.warmpath.domain.RelationshipEdge;
import io.github.vishalmysore.warmpath.domain.ScoredPath;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Orders scored paths best first and assigns 1-based ranks.
 *
 * Ties on score go to the path with fewer hops, then to the path whose
 * stalest edge was active most recently. Paths still tied keep their input
 * order.
 */
public class PathRanker {

    static final Comparator<ScoredPath> ORDER = Comparator
            .comparingDouble(ScoredPath::getScore).reversed()
            .thenComparingInt((ScoredPath p) -> p.getPath().hopCount())
            .thenComparing(p -> stalestInteraction(p.getPath()),
                    Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

    public List<RankedPath> rank(Collection<ScoredPath> scoredPaths, int maxResults) {
        if (maxResults < 0)
            throw new IllegalArgumentException("maxResults must be non-negative, got " + maxResults);

        List<ScoredPath> sorted = new ArrayList<>(scoredPaths);
        sorted.sort(ORDER);

        List<RankedPath> ranked = new ArrayList<>();
        for (int i = 0; i < Math.min(maxResults, sorted.size()); i++) {
            ScoredPath scored = sorted.get(i);
            ranked.add(RankedPath.builder()
                    .path(scored.getPath())
                    .score(scored.getScore())
                    .rank(i + 1)
                    .build());
        }
        return ranked;
    }

    /**
     * Oldest last-interaction time across the path's edges, or null when any
     * edge has no timestamp.
     */
    static Instant stalestInteraction(IntroPath path) {
        Instant stalest = null;
        for (RelationshipEdge edge : path.getEdges()) {
            Instant at = edge.getLastInteractionAt();
            if (at == null)
                return null;
            if (stalest == null || at.isBefore(stalest))
                stalest = at;
        }
        return stalest;
    }
}
