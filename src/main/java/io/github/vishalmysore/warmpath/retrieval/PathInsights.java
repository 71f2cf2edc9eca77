package io.github.vishalmysore.warmpath.retrieval;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Factor breakdown of one introduction path, for showing the user why a
 * path ranks where it does and whom to ask first.
 */
@Value
@Builder
public class PathInsights {
    String introducerId;
    String introducerName;

    // Weight of the first hop, i.e. the user's tie to the introducer
    double introducerStrength;

    // Mean weight of the remaining hops, 1.0 for a direct connection
    double downstreamStrength;

    double lengthPenalty;
    double recencyScore;
    String suggestedChannel;
    List<String> reasons;

    public String reasoning() {
        return reasons.isEmpty() ? "" : String.join(". ", reasons) + ".";
    }
}
