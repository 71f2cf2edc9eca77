package io.github.vishalmysore.warmpath.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A candidate duplicate of a target person record.
 */
@Value
@Builder
public class EntityResolutionMatch {
    String targetId;
    String candidateId;
    double matchScore;
    MatchMethod matchMethod;

    @Builder.Default
    List<MatchEvidence> evidence = List.of();

    MatchRecommendation recommendation;

    public boolean isActionable() {
        return recommendation != MatchRecommendation.REJECT;
    }
}
