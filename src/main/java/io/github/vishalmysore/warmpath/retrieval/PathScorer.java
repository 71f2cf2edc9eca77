package io.github.vishalmysore.warmpath.retrieval;

import io.github.vishalmysore.warmpath.domain.IntroPath;
import io.github.vishalmysore.warmpath.domain.RelationshipEdge;
import io.github.vishalmysore.warmpath.domain.ScoredPath;

import java.util.Collection;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Scores a path as the product of its edge weights times a hop penalty of
 * {@code HOP_PENALTY^(edges - 1)}. A single weak edge drags the whole chain
 * down, and every hop beyond the first costs another 10%.
 */
public class PathScorer {
    private static final Logger log = Logger.getLogger(PathScorer.class.getName());

    public static final double HOP_PENALTY = 0.9;

    // Stand-in for edges that were never scored
    public static final double DEFAULT_EDGE_WEIGHT = 0.5;

    public double score(IntroPath path) {
        List<RelationshipEdge> edges = path.getEdges();
        if (edges.isEmpty())
            return 0.0;

        double score = 1.0;
        for (RelationshipEdge edge : edges) {
            if (!edge.hasWeight()) {
                log.warning("Edge " + edge.getFromId() + " -> " + edge.getToId() + " has no weight, using "
                        + DEFAULT_EDGE_WEIGHT);
            }
            score *= effectiveWeight(edge);
        }
        score *= Math.pow(HOP_PENALTY, edges.size() - 1);
        return Math.max(0.0, Math.min(1.0, score));
    }

    public List<ScoredPath> scoreAll(Collection<IntroPath> paths) {
        return paths.stream()
                .map(path -> ScoredPath.of(path, score(path)))
                .collect(Collectors.toList());
    }

    static double effectiveWeight(RelationshipEdge edge) {
        return edge.hasWeight() ? edge.getWeight() : DEFAULT_EDGE_WEIGHT;
    }
}
