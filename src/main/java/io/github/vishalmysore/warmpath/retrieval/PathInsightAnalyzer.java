package io.github.vishalmysore.warmpath.retrieval;

import io.github.vishalmysore.warmpath.domain.IntroPath;
import io.github.vishalmysore.warmpath.domain.RelationshipEdge;
import io.github.vishalmysore.warmpath.scoring.RelationshipStrengthScorer;

import java.util.*;

/**
 * Breaks a path down into the factors a user cares about when deciding
 * whether to ask for the introduction.
 */
public class PathInsightAnalyzer {

    private static final List<String> CHANNEL_PRIORITY = List.of("email", "linkedin", "message", "call", "meeting");
    private static final String FALLBACK_CHANNEL = "email";

    private final RelationshipStrengthScorer strengthScorer;

    public PathInsightAnalyzer(RelationshipStrengthScorer strengthScorer) {
        this.strengthScorer = Objects.requireNonNull(strengthScorer, "strengthScorer");
    }

    public PathInsights analyze(IntroPath path, Map<String, String> nodeNames) {
        List<RelationshipEdge> edges = path.getEdges();
        if (edges.isEmpty()) {
            throw new IllegalArgumentException("Cannot analyze a path without edges");
        }

        RelationshipEdge first = edges.get(0);
        double introducerStrength = PathScorer.effectiveWeight(first);
        double downstreamStrength = edges.size() == 1 ? 1.0
                : edges.subList(1, edges.size()).stream().mapToDouble(PathScorer::effectiveWeight).average().orElse(1.0);
        double recency = edges.stream()
                .mapToDouble(e -> strengthScorer.recencyFactor(e.getLastInteractionAt()))
                .average()
                .orElse(0.0);

        List<String> reasons = new ArrayList<>();
        if (introducerStrength >= 0.8) {
            reasons.add("Very strong relationship with introducer");
        } else if (introducerStrength >= 0.6) {
            reasons.add("Good relationship with introducer");
        }
        if (recency >= 0.8) {
            reasons.add("Recent interactions on path");
        }
        if (edges.size() == 1) {
            reasons.add("Direct connection");
        } else if (edges.size() == 2) {
            reasons.add("Short 2-hop path");
        }

        String introducerId = path.getNodeIds().get(1);
        return PathInsights.builder()
                .introducerId(introducerId)
                .introducerName(nodeNames.getOrDefault(introducerId, introducerId))
                .introducerStrength(introducerStrength)
                .downstreamStrength(downstreamStrength)
                .lengthPenalty(Math.pow(PathScorer.HOP_PENALTY, edges.size() - 1))
                .recencyScore(recency)
                .suggestedChannel(suggestChannel(first))
                .reasons(List.copyOf(reasons))
                .build();
    }

    /**
     * Best channel to ask the introducer through, by fixed preference.
     */
    static String suggestChannel(RelationshipEdge edge) {
        Set<String> available = new TreeSet<>();
        for (String channel : edge.getChannels()) {
            if (channel != null && !channel.isBlank()) {
                available.add(channel.trim().toLowerCase(Locale.ROOT));
            }
        }
        for (String preferred : CHANNEL_PRIORITY) {
            if (available.contains(preferred)) {
                return preferred;
            }
        }
        return available.isEmpty() ? FALLBACK_CHANNEL : available.iterator().next();
    }
}
