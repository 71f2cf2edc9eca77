package io.github.vishalmysore.warmpath.domain;

import lombok.Builder;
import lombok.Value;

/**
 * The four independently computed strength factors, each in [0,1]. Only their
 * weighted combination is ever persisted as an edge weight.
 */
@Value
@Builder
public class RelationshipStrengthFactors {
    double recency;
    double frequency;
    double mutuality;
    double channels;
}
