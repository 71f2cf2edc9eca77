package io.github.vishalmysore.warmpath.retrieval;

import io.github.vishalmysore.warmpath.domain.PathResult;
import io.github.vishalmysore.warmpath.domain.PersonNode;
import io.github.vishalmysore.warmpath.domain.PersonRecord;
import io.github.vishalmysore.warmpath.domain.RankedPath;
import io.github.vishalmysore.warmpath.domain.RelationshipRecord;
import io.github.vishalmysore.warmpath.domain.ScoredPath;
import io.github.vishalmysore.warmpath.domain.TenantScope;
import io.github.vishalmysore.warmpath.graph.BatchGraphDataProvider;
import io.github.vishalmysore.warmpath.graph.FrontierSource;
import io.github.vishalmysore.warmpath.graph.GraphBuilder;
import io.github.vishalmysore.warmpath.graph.GraphDataProvider;
import io.github.vishalmysore.warmpath.graph.ProviderFrontierSource;
import io.github.vishalmysore.warmpath.graph.RelationshipGraph;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Warm introduction pathfinder. Runs the stages in order:
 *
 * 1. SEARCH: enumerate acyclic paths up to maxHops, pruning weak edges
 * 2. SCORE: product of edge weights with a per-hop penalty
 * 3. RANK: best first, truncated to maxResults
 * 4. EXPLAIN: one sentence per path
 *
 * An empty result means no warm path exists. Failures of the data provider
 * surface as {@link PathfindingException} so the two are never confused.
 */
public class Pathfinder {
    private static final Logger log = Logger.getLogger(Pathfinder.class.getName());

    private final GraphBuilder graphBuilder;
    private final MultiPathSearch search;
    private final PathScorer scorer;
    private final PathRanker ranker;
    private final PathExplainer explainer;
    private final Clock clock;

    public Pathfinder() {
        this(Clock.systemUTC());
    }

    public Pathfinder(Clock clock) {
        this(new GraphBuilder(), new MultiPathSearch(clock), new PathScorer(), new PathRanker(), new PathExplainer(),
                clock);
    }

    public Pathfinder(GraphBuilder graphBuilder, MultiPathSearch search, PathScorer scorer, PathRanker ranker,
                      PathExplainer explainer, Clock clock) {
        this.graphBuilder = Objects.requireNonNull(graphBuilder, "graphBuilder");
        this.search = Objects.requireNonNull(search, "search");
        this.scorer = Objects.requireNonNull(scorer, "scorer");
        this.ranker = Objects.requireNonNull(ranker, "ranker");
        this.explainer = Objects.requireNonNull(explainer, "explainer");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Ranked and explained paths from {@code sourceId} to {@code targetId}.
     */
    public List<RankedPath> findRankedPaths(FrontierSource source, String sourceId, String targetId,
                                            PathfinderOptions options) {
        Objects.requireNonNull(source, "source");
        options.validate();

        SearchLimits.SearchLimitsBuilder limits = SearchLimits.builder()
                .maxHops(options.getMaxHops())
                .minEdgeWeight(options.getMinStrength())
                .maxExpansions(options.getMaxExpansions());
        if (options.getTimeout() != null) {
            limits.deadline(clock.instant().plus(options.getTimeout()));
        }

        SearchOutcome outcome;
        try {
            outcome = search.run(source, sourceId, targetId, limits.build());
        } catch (RuntimeException e) {
            throw new PathfindingException("Search " + sourceId + " -> " + targetId + " failed: " + e.getMessage(), e);
        }

        List<ScoredPath> scored = scorer.scoreAll(outcome.getPaths());
        List<RankedPath> ranked = ranker.rank(scored, options.getMaxResults());
        List<RankedPath> explained = explainer.explainAll(ranked, outcome.nodeNames());

        log.info("Pathfinding " + sourceId + " -> " + targetId + ": " + outcome.getPaths().size() + " candidates, "
                + explained.size() + " returned" + (outcome.isTruncated() ? " (budget reached)" : ""));
        return explained;
    }

    public List<PathResult> findPaths(FrontierSource source, String sourceId, String targetId,
                                      PathfinderOptions options) {
        return toResults(findRankedPaths(source, sourceId, targetId, options));
    }

    /**
     * Builds a throwaway graph from already-fetched records and searches it.
     */
    public List<PathResult> findPaths(Collection<PersonRecord> persons, Collection<RelationshipRecord> relationships,
                                      String sourceId, String targetId, PathfinderOptions options) {
        RelationshipGraph graph = graphBuilder.build(persons, relationships);
        return findPaths(graph, sourceId, targetId, options);
    }

    /**
     * Loads the tenant's whole graph through the provider and searches from
     * the user's own node. When {@code selfId} is null or not in the graph,
     * the node carrying the self marker is used; without one there is
     * nothing to search from and the result is empty.
     */
    public List<PathResult> findWarmIntroPaths(GraphDataProvider provider, TenantScope scope, String selfId,
                                               String targetId, PathfinderOptions options) {
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(scope, "scope");
        options.validate();

        RelationshipGraph graph;
        try {
            graph = graphBuilder.build(provider, scope);
        } catch (RuntimeException e) {
            throw new PathfindingException("Could not load graph of tenant " + scope.getTenantId()
                    + " for target " + targetId, e);
        }

        // An id the tenant no longer knows falls back to the self marker
        Optional<String> origin = graph.containsNode(selfId)
                ? Optional.of(selfId)
                : graph.findSelfNode().map(PersonNode::getId);
        if (origin.isEmpty()) {
            log.info("No self node in tenant " + scope.getTenantId() + ", nothing to search from");
            return List.of();
        }
        return findPaths(graph, origin.get(), targetId, options);
    }

    /**
     * Searches straight against storage, one round trip per level, without
     * materializing the tenant's graph. The origin must be given explicitly.
     */
    public List<PathResult> findWarmIntroPathsBatched(BatchGraphDataProvider provider, TenantScope scope,
                                                      String selfId, String targetId, PathfinderOptions options) {
        Objects.requireNonNull(selfId, "selfId");
        FrontierSource source = new ProviderFrontierSource(provider, scope);
        try {
            return findPaths(source, selfId, targetId, options);
        } catch (PathfindingException e) {
            throw new PathfindingException("Batched search in tenant " + scope.getTenantId() + " for target "
                    + targetId + " failed", e);
        }
    }

    private static List<PathResult> toResults(List<RankedPath> rankedPaths) {
        return rankedPaths.stream().map(PathResult::from).collect(Collectors.toList());
    }
}
