package io.github.vishalmysore.warmpath.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A directed edge in the relationship graph. The graph inserts both
 * directions for every relationship, so traversal is effectively undirected.
 * The weight is the strength scorer's output and may be absent on edges
 * that were never scored.
 */
@Value
@Builder(toBuilder = true)
public class RelationshipEdge {
    String fromId;
    String toId;
    Double weight;

    @Builder.Default
    Set<String> channels = Set.of();

    Instant lastInteractionAt;

    public boolean hasWeight() {
        return weight != null && !weight.isNaN();
    }

    public RelationshipEdge reversed() {
        return toBuilder().fromId(toId).toId(fromId).build();
    }

    /**
     * Converts this edge to a schema.org "knows" relationship.
     */
    public Map<String, Object> toJsonLd() {
        Map<String, Object> jsonLd = new LinkedHashMap<>();
        jsonLd.put("@type", "warmpath:Relationship");
        jsonLd.put("source", Map.of("@id", "urn:warmpath:person:" + fromId));
        jsonLd.put("knows", Map.of("@id", "urn:warmpath:person:" + toId));
        if (hasWeight()) {
            jsonLd.put("weight", weight);
        }
        if (!channels.isEmpty()) {
            jsonLd.put("channels", channels);
        }
        if (lastInteractionAt != null) {
            jsonLd.put("lastInteraction", lastInteractionAt.toString());
        }
        return jsonLd;
    }
}
