package io.github.vishalmysore.warmpath.graph;

import io.github.vishalmysore.warmpath.domain.PersonNode;
import io.github.vishalmysore.warmpath.domain.PersonRecord;
import io.github.vishalmysore.warmpath.domain.RelationshipEdge;
import io.github.vishalmysore.warmpath.domain.RelationshipRecord;
import io.github.vishalmysore.warmpath.domain.TenantScope;

import java.util.*;
import java.util.logging.Logger;

/**
 * Frontier source backed directly by storage. Each search level costs one
 * relationship query and one person query, regardless of how many nodes are
 * on the frontier.
 */
public class ProviderFrontierSource implements FrontierSource {
    private static final Logger log = Logger.getLogger(ProviderFrontierSource.class.getName());

    private final BatchGraphDataProvider provider;
    private final TenantScope scope;

    public ProviderFrontierSource(BatchGraphDataProvider provider, TenantScope scope) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.scope = Objects.requireNonNull(scope, "scope");
    }

    @Override
    public Map<String, PersonNode> fetchNodes(Collection<String> nodeIds) {
        Map<String, PersonNode> found = new LinkedHashMap<>();
        if (nodeIds.isEmpty()) {
            return found;
        }
        for (PersonRecord record : provider.findPersons(scope, nodeIds)) {
            if (record.getId() != null) {
                found.put(record.getId(), record.toNode());
            }
        }
        return found;
    }

    @Override
    public FrontierBatch fetchFrontier(Collection<String> nodeIds) {
        Set<String> frontier = new LinkedHashSet<>(nodeIds);
        if (frontier.isEmpty()) {
            return FrontierBatch.of(Map.of(), Map.of());
        }

        // Mirror each stored relationship so that both endpoints see it;
        // parallel records for the same pair collapse into one edge
        Map<String, Map<String, RelationshipEdge>> outgoing = new LinkedHashMap<>();
        frontier.forEach(id -> outgoing.put(id, new LinkedHashMap<>()));
        for (RelationshipRecord record : provider.findRelationships(scope, frontier)) {
            RelationshipEdge edge = record.toEdge();
            if (edge.getFromId().equals(edge.getToId())) {
                continue;
            }
            if (frontier.contains(edge.getFromId())) {
                outgoing.get(edge.getFromId()).merge(edge.getToId(), edge, GraphBuilder::mergeParallel);
            }
            if (frontier.contains(edge.getToId())) {
                RelationshipEdge reverse = edge.reversed();
                outgoing.get(edge.getToId()).merge(reverse.getToId(), reverse, GraphBuilder::mergeParallel);
            }
        }

        Set<String> farIds = new LinkedHashSet<>();
        outgoing.values().forEach(byTarget -> farIds.addAll(byTarget.keySet()));
        Map<String, PersonNode> neighbors = fetchNodes(farIds);

        Map<String, List<RelationshipEdge>> edgesByNode = new LinkedHashMap<>();
        int unsynced = 0;
        for (Map.Entry<String, Map<String, RelationshipEdge>> entry : outgoing.entrySet()) {
            List<RelationshipEdge> edges = new ArrayList<>();
            for (RelationshipEdge edge : entry.getValue().values()) {
                if (neighbors.containsKey(edge.getToId())) {
                    edges.add(edge);
                } else {
                    unsynced++;
                }
            }
            edgesByNode.put(entry.getKey(), edges);
        }
        if (unsynced > 0) {
            log.warning("Ignored " + unsynced + " edges whose far endpoint is not available in scope "
                    + scope.getTenantId());
        }
        return FrontierBatch.of(edgesByNode, neighbors);
    }
}
