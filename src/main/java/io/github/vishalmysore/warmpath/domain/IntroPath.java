package io.github.vishalmysore.warmpath.domain;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An acyclic chain of people from a source to a target together with the
 * edges actually traversed. Always holds {@code edges.size() == nodeIds.size() - 1}.
 */
@Value
public class IntroPath {
    List<String> nodeIds;
    List<RelationshipEdge> edges;

    private IntroPath(List<String> nodeIds, List<RelationshipEdge> edges) {
        this.nodeIds = Collections.unmodifiableList(nodeIds);
        this.edges = Collections.unmodifiableList(edges);
    }

    public static IntroPath of(List<String> nodeIds, List<RelationshipEdge> edges) {
        if (nodeIds.size() != edges.size() + 1) {
            throw new IllegalArgumentException("A path of " + nodeIds.size() + " nodes needs "
                    + (nodeIds.size() - 1) + " edges, got " + edges.size());
        }
        return new IntroPath(new ArrayList<>(nodeIds), new ArrayList<>(edges));
    }

    /**
     * The zero-hop path sitting on the search origin.
     */
    public static IntroPath origin(String sourceId) {
        return new IntroPath(List.of(sourceId), List.of());
    }

    public IntroPath extend(RelationshipEdge edge) {
        if (!edge.getFromId().equals(targetId())) {
            throw new IllegalArgumentException("Edge " + edge.getFromId() + "->" + edge.getToId()
                    + " does not continue path ending at " + targetId());
        }
        List<String> ids = new ArrayList<>(nodeIds);
        ids.add(edge.getToId());
        List<RelationshipEdge> traversed = new ArrayList<>(edges);
        traversed.add(edge);
        return new IntroPath(ids, traversed);
    }

    public boolean contains(String nodeId) {
        return nodeIds.contains(nodeId);
    }

    public int hopCount() {
        return edges.size();
    }

    public String sourceId() {
        return nodeIds.get(0);
    }

    public String targetId() {
        return nodeIds.get(nodeIds.size() - 1);
    }

    public List<String> intermediaryIds() {
        return nodeIds.size() <= 2 ? List.of() : nodeIds.subList(1, nodeIds.size() - 1);
    }
}
