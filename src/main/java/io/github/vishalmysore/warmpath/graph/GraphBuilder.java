package io.github.vishalmysore.warmpath.graph;

import io.github.vishalmysore.warmpath.domain.PersonRecord;
import io.github.vishalmysore.warmpath.domain.RelationshipEdge;
import io.github.vishalmysore.warmpath.domain.RelationshipRecord;
import io.github.vishalmysore.warmpath.domain.TenantScope;

import java.time.Instant;
import java.util.*;
import java.util.logging.Logger;

/**
 * Turns flat person and relationship records into a {@link RelationshipGraph}.
 *
 * Precondition: the records are already scoped to a single tenant. The
 * builder inserts every relationship in both directions with the same weight
 * and channels, collapses parallel records for the same pair into one edge,
 * and drops records whose endpoints are not among the supplied persons.
 */
public class GraphBuilder {
    private static final Logger log = Logger.getLogger(GraphBuilder.class.getName());

    /**
     * Fetches the tenant's records through the given provider and builds the
     * graph. The provider handle is owned by the caller.
     */
    public RelationshipGraph build(GraphDataProvider provider, TenantScope scope) {
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(scope, "scope");
        return build(provider.listPersons(scope), provider.listRelationships(scope));
    }

    public RelationshipGraph build(Collection<PersonRecord> persons, Collection<RelationshipRecord> relationships) {
        RelationshipGraph graph = new RelationshipGraph();
        for (PersonRecord person : persons) {
            if (person.getId() == null) {
                log.warning("Skipping person record without id");
                continue;
            }
            graph.addNode(person.toNode());
        }

        Map<String, RelationshipEdge> collapsed = new LinkedHashMap<>();
        int dropped = 0;
        for (RelationshipRecord record : relationships) {
            if (!graph.containsNode(record.getFromId()) || !graph.containsNode(record.getToId())
                    || record.getFromId().equals(record.getToId())) {
                dropped++;
                continue;
            }
            collapsed.merge(pairKey(record.getFromId(), record.getToId()), record.toEdge(), GraphBuilder::mergeParallel);
        }

        for (RelationshipEdge edge : collapsed.values()) {
            graph.addEdge(edge);
            graph.addEdge(edge.reversed());
        }

        if (dropped > 0) {
            log.warning("Dropped " + dropped + " relationship records with unknown or identical endpoints");
        }
        log.info("Relationship graph built: " + graph.getNodeCount() + " people, " + collapsed.size()
                + " relationships");
        return graph;
    }

    private static String pairKey(String a, String b) {
        return a.compareTo(b) <= 0 ? a + "\u0000" + b : b + "\u0000" + a;
    }

    /**
     * Parallel records keep the strongest weight, the union of channels and
     * the latest interaction. The direction of the first record is kept.
     */
    static RelationshipEdge mergeParallel(RelationshipEdge first, RelationshipEdge second) {
        Double weight = first.getWeight();
        if (!first.hasWeight() || (second.hasWeight() && second.getWeight() > first.getWeight())) {
            weight = second.hasWeight() ? second.getWeight() : first.getWeight();
        }
        Set<String> channels = new LinkedHashSet<>(first.getChannels());
        channels.addAll(second.getChannels());
        return first.toBuilder()
                .weight(weight)
                .channels(Set.copyOf(channels))
                .lastInteractionAt(latest(first.getLastInteractionAt(), second.getLastInteractionAt()))
                .build();
    }

    private static Instant latest(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.isAfter(b) ? a : b;
    }
}
