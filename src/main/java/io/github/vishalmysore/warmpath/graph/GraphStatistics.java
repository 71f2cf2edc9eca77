package io.github.vishalmysore.warmpath.graph;

import lombok.Builder;
import lombok.Value;

/**
 * Summary counts over one built relationship graph.
 */
@Value
@Builder
public class GraphStatistics {
    int personCount;
    int relationshipCount;
    double averageConnections;
    int strongConnections;
    int isolatedPersons;
}
