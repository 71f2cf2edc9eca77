package io.github.vishalmysore.warmpath.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outbound result handed to the API layer.
 */
@Value
@Builder
public class PathResult {
    List<String> path;
    double score;
    String explanation;
    int rank;

    public static PathResult from(RankedPath rankedPath) {
        return PathResult.builder()
                .path(rankedPath.getPath().getNodeIds())
                .score(rankedPath.getScore())
                .explanation(rankedPath.getExplanation())
                .rank(rankedPath.getRank())
                .build();
    }
}
