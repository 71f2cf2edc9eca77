package io.github.vishalmysore.warmpath.graph;

import io.github.vishalmysore.warmpath.domain.PersonNode;
import io.github.vishalmysore.warmpath.domain.RelationshipEdge;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Data for one search level: outgoing edges per frontier node and the
 * neighbor nodes those edges lead to.
 */
@Value(staticConstructor = "of")
public class FrontierBatch {
    Map<String, List<RelationshipEdge>> edgesByNode;
    Map<String, PersonNode> neighbors;

    public List<RelationshipEdge> edgesOf(String nodeId) {
        return edgesByNode.getOrDefault(nodeId, List.of());
    }
}
