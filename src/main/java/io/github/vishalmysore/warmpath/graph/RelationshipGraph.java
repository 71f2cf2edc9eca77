package io.github.vishalmysore.warmpath.graph;

import io.github.vishalmysore.warmpath.domain.PersonNode;
import io.github.vishalmysore.warmpath.domain.RelationshipEdge;

import java.util.*;
import java.util.stream.Collectors;

/**
 * In-memory relationship graph of one tenant: people keyed by id and an
 * adjacency list of outgoing edges. Every node has an adjacency entry, even
 * when it has no relationships, and every edge endpoint is a known node.
 *
 * Instances are populated by {@link GraphBuilder} and are read-only once
 * handed out, so a graph can be searched without synchronization.
 */
public class RelationshipGraph implements FrontierSource {

    // Edges at or above this weight count as strong connections
    public static final double STRONG_CONNECTION_THRESHOLD = 0.7;

    private final Map<String, PersonNode> nodes = new LinkedHashMap<>();
    private final Map<String, List<RelationshipEdge>> adjacency = new LinkedHashMap<>();
    private int edgeCount;

    RelationshipGraph() {
    }

    void addNode(PersonNode node) {
        nodes.put(node.getId(), node);
        adjacency.putIfAbsent(node.getId(), new ArrayList<>());
    }

    void addEdge(RelationshipEdge edge) {
        adjacency.computeIfAbsent(edge.getFromId(), k -> new ArrayList<>()).add(edge);
        edgeCount++;
    }

    public PersonNode getNode(String id) {
        return nodes.get(id);
    }

    public boolean containsNode(String id) {
        return id != null && nodes.containsKey(id);
    }

    public int getNodeCount() {
        return nodes.size();
    }

    /**
     * Number of directed edges, i.e. twice the number of relationships.
     */
    public int getEdgeCount() {
        return edgeCount;
    }

    public Collection<PersonNode> getAllNodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public List<RelationshipEdge> getEdges(String nodeId) {
        return Collections.unmodifiableList(adjacency.getOrDefault(nodeId, Collections.emptyList()));
    }

    public List<PersonNode> getNeighbors(String nodeId) {
        return getEdges(nodeId).stream()
                .map(edge -> nodes.get(edge.getToId()))
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
    }

    /**
     * Display name per node id, for rendering path explanations.
     */
    public Map<String, String> nodeNames() {
        Map<String, String> names = new LinkedHashMap<>();
        for (PersonNode node : nodes.values()) {
            names.put(node.getId(), node.getDisplayName());
        }
        return names;
    }

    /**
     * The searching user's own node, if one carries the self marker.
     */
    public Optional<PersonNode> findSelfNode() {
        return nodes.values().stream().filter(PersonNode::isSelf).findFirst();
    }

    /**
     * Edges in the direction they were stored, one per relationship.
     */
    public List<RelationshipEdge> getRelationships() {
        List<RelationshipEdge> relationships = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (List<RelationshipEdge> edges : adjacency.values()) {
            for (RelationshipEdge edge : edges) {
                String a = edge.getFromId();
                String b = edge.getToId();
                String key = a.compareTo(b) <= 0 ? a + "\u0000" + b : b + "\u0000" + a;
                if (seen.add(key)) {
                    relationships.add(edge);
                }
            }
        }
        return relationships;
    }

    public GraphStatistics statistics() {
        List<RelationshipEdge> relationships = getRelationships();
        int strong = (int) relationships.stream()
                .filter(e -> e.hasWeight() && e.getWeight() >= STRONG_CONNECTION_THRESHOLD)
                .count();
        int isolated = (int) nodes.keySet().stream()
                .filter(id -> adjacency.getOrDefault(id, List.of()).isEmpty())
                .count();
        double average = nodes.isEmpty() ? 0.0 : (double) edgeCount / nodes.size();
        return GraphStatistics.builder()
                .personCount(nodes.size())
                .relationshipCount(relationships.size())
                .averageConnections(average)
                .strongConnections(strong)
                .isolatedPersons(isolated)
                .build();
    }

    @Override
    public Map<String, PersonNode> fetchNodes(Collection<String> nodeIds) {
        Map<String, PersonNode> found = new LinkedHashMap<>();
        for (String id : nodeIds) {
            PersonNode node = nodes.get(id);
            if (node != null) {
                found.put(id, node);
            }
        }
        return found;
    }

    @Override
    public FrontierBatch fetchFrontier(Collection<String> nodeIds) {
        Map<String, List<RelationshipEdge>> edgesByNode = new LinkedHashMap<>();
        Map<String, PersonNode> neighbors = new LinkedHashMap<>();
        for (String id : nodeIds) {
            List<RelationshipEdge> edges = getEdges(id);
            edgesByNode.put(id, edges);
            for (RelationshipEdge edge : edges) {
                neighbors.putIfAbsent(edge.getToId(), nodes.get(edge.getToId()));
            }
        }
        return FrontierBatch.of(edgesByNode, neighbors);
    }
}
