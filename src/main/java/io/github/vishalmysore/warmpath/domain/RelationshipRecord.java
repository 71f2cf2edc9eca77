package io.github.vishalmysore.warmpath.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

/**
 * Relationship row handed over by the storage layer. Stored once per pair;
 * the graph builder mirrors it in both directions.
 */
@Value
@Builder
public class RelationshipRecord {
    String fromId;
    String toId;
    Double weight;

    @Builder.Default
    Set<String> channels = Set.of();

    Instant lastInteractionAt;

    public RelationshipEdge toEdge() {
        return RelationshipEdge.builder()
                .fromId(fromId)
                .toId(toId)
                .weight(weight)
                .channels(channels == null ? Set.of() : Set.copyOf(channels))
                .lastInteractionAt(lastInteractionAt)
                .build();
    }
}
