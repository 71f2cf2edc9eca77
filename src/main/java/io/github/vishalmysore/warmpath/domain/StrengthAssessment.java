package io.github.vishalmysore.warmpath.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Edge weight together with the factors it came from and how complete the
 * underlying interaction data was.
 */
@Value
@Builder
public class StrengthAssessment {
    double score;
    RelationshipStrengthFactors factors;
    double confidence;
}
