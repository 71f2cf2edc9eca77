package io.github.vishalmysore.warmpath.graph;

import io.github.vishalmysore.warmpath.domain.PersonNode;

import java.util.Collection;
import java.util.Map;

/**
 * Batched access to the relationship graph, one call per search level.
 * A fully built {@link RelationshipGraph} answers from memory; a
 * storage-backed implementation answers each call with a single round trip.
 */
public interface FrontierSource {

    /**
     * Looks up the given people. Ids that are unknown are simply absent from
     * the returned map.
     */
    Map<String, PersonNode> fetchNodes(Collection<String> nodeIds);

    /**
     * Returns the outgoing edges of every node on the frontier, together with
     * the people at the far end of those edges.
     */
    FrontierBatch fetchFrontier(Collection<String> nodeIds);
}
