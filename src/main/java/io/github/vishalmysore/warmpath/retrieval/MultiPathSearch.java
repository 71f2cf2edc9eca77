package io.github.vishalmysore.warmpath.retrieval;

import io.github.vishalmysore.warmpath.domain.IntroPath;
import io.github.vishalmysore.warmpath.domain.PersonNode;
import io.github.vishalmysore.warmpath.domain.RelationshipEdge;
import io.github.vishalmysore.warmpath.graph.FrontierBatch;
import io.github.vishalmysore.warmpath.graph.FrontierSource;

import java.time.Clock;
import java.util.*;
import java.util.logging.Logger;

/**
 * Breadth-bounded search for every acyclic path between two people.
 *
 * The search expands level by level, fetching the whole frontier of a level
 * with one {@link FrontierSource#fetchFrontier} call. Cycles are avoided per
 * path only: a node used by one branch stays reachable through another, so
 * distinct routes through the same intermediary are all kept. Reaching the
 * target ends a branch. Edges below the minimum weight are pruned during
 * expansion.
 *
 * Absent or identical endpoints, and graphs with no route, all yield an
 * empty result rather than an error.
 */
public class MultiPathSearch {
    private static final Logger log = Logger.getLogger(MultiPathSearch.class.getName());

    private final Clock clock;

    public MultiPathSearch() {
        this(Clock.systemUTC());
    }

    public MultiPathSearch(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public List<IntroPath> search(FrontierSource source, String sourceId, String targetId, int maxHops) {
        return run(source, sourceId, targetId, SearchLimits.ofHops(maxHops)).getPaths();
    }

    public SearchOutcome run(FrontierSource source, String sourceId, String targetId, SearchLimits limits) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(limits, "limits");
        if (sourceId == null || targetId == null || sourceId.equals(targetId) || limits.getMaxHops() < 1) {
            return SearchOutcome.empty();
        }

        Map<String, PersonNode> discovered = new LinkedHashMap<>(source.fetchNodes(List.of(sourceId, targetId)));
        if (!discovered.containsKey(sourceId) || !discovered.containsKey(targetId)) {
            log.info("Search skipped: " + (discovered.containsKey(sourceId) ? targetId : sourceId) + " not in graph");
            return SearchOutcome.empty();
        }

        List<IntroPath> results = new ArrayList<>();
        List<IntroPath> frontier = List.of(IntroPath.origin(sourceId));
        int expansions = 0;
        boolean truncated = false;

        levels:
        for (int depth = 0; depth < limits.getMaxHops() && !frontier.isEmpty(); depth++) {
            Set<String> tails = new LinkedHashSet<>();
            frontier.forEach(path -> tails.add(path.targetId()));
            FrontierBatch batch = source.fetchFrontier(tails);
            batch.getNeighbors().forEach((id, node) -> {
                if (node != null)
                    discovered.putIfAbsent(id, node);
            });
            log.fine("Level " + depth + ": " + frontier.size() + " partial paths over " + tails.size() + " nodes");

            List<IntroPath> next = new ArrayList<>();
            for (IntroPath path : frontier) {
                if (budgetExhausted(limits, expansions)) {
                    truncated = true;
                    break levels;
                }
                expansions++;

                for (RelationshipEdge edge : batch.edgesOf(path.targetId())) {
                    if (PathScorer.effectiveWeight(edge) < limits.getMinEdgeWeight())
                        continue;
                    String neighborId = edge.getToId();
                    if (path.contains(neighborId) || !discovered.containsKey(neighborId))
                        continue;

                    IntroPath extended = path.extend(edge);
                    if (neighborId.equals(targetId)) {
                        results.add(extended);
                    } else if (extended.hopCount() < limits.getMaxHops()) {
                        next.add(extended);
                    }
                }
            }
            frontier = next;
        }

        if (truncated) {
            log.warning("Search " + sourceId + " -> " + targetId + " stopped on budget after " + expansions
                    + " expansions with " + results.size() + " paths");
        } else {
            log.info("Search " + sourceId + " -> " + targetId + " found " + results.size() + " paths ("
                    + expansions + " expansions)");
        }
        return new SearchOutcome(results, discovered, truncated, expansions);
    }

    private boolean budgetExhausted(SearchLimits limits, int expansions) {
        if (limits.getMaxExpansions() > 0 && expansions >= limits.getMaxExpansions())
            return true;
        return limits.getDeadline() != null && clock.instant().isAfter(limits.getDeadline());
    }
}
