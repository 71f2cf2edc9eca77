package io.github.vishalmysore.warmpath.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import io.github.vishalmysore.warmpath.domain.IntroPath;
import io.github.vishalmysore.warmpath.domain.RelationshipEdge;
import io.github.vishalmysore.warmpath.domain.StrengthWeights;
import io.github.vishalmysore.warmpath.scoring.RelationshipStrengthScorer;

class PathInsightAnalyzerTest {

    private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");

    private final PathInsightAnalyzer analyzer = new PathInsightAnalyzer(
            new RelationshipStrengthScorer(Clock.fixed(NOW, ZoneOffset.UTC), StrengthWeights.DEFAULT));

    private static RelationshipEdge edge(String from, String to, double weight, Instant at, String... channels) {
        return RelationshipEdge.builder().fromId(from).toId(to).weight(weight).lastInteractionAt(at)
                .channels(Set.of(channels)).build();
    }

    @Test
    void breaksDownTwoHopPath() {
        IntroPath path = IntroPath.of(List.of("me", "alice", "dave"), List.of(
                edge("me", "alice", 0.9, NOW, "meeting", "linkedin"),
                edge("alice", "dave", 0.7, NOW.minus(Duration.ofDays(90)), "email")));

        PathInsights insights = analyzer.analyze(path, Map.of("alice", "Alice Smith"));

        assertThat(insights.getIntroducerId()).isEqualTo("alice");
        assertThat(insights.getIntroducerName()).isEqualTo("Alice Smith");
        assertThat(insights.getIntroducerStrength()).isEqualTo(0.9);
        assertThat(insights.getDownstreamStrength()).isEqualTo(0.7);
        assertThat(insights.getLengthPenalty()).isCloseTo(0.9, within(1e-9));
        assertThat(insights.getRecencyScore()).isCloseTo(0.75, within(1e-9));
        assertThat(insights.getSuggestedChannel()).isEqualTo("linkedin");
        assertThat(insights.getReasons())
                .containsExactly("Very strong relationship with introducer", "Short 2-hop path");
        assertThat(insights.reasoning())
                .isEqualTo("Very strong relationship with introducer. Short 2-hop path.");
    }

    @Test
    void directConnectionHasNoDownstreamLoss() {
        IntroPath path = IntroPath.of(List.of("me", "bob"), List.of(edge("me", "bob", 0.65, NOW, "call")));

        PathInsights insights = analyzer.analyze(path, Map.of());

        assertThat(insights.getDownstreamStrength()).isEqualTo(1.0);
        assertThat(insights.getLengthPenalty()).isEqualTo(1.0);
        assertThat(insights.getIntroducerName()).isEqualTo("bob");
        assertThat(insights.getReasons()).containsExactly(
                "Good relationship with introducer", "Recent interactions on path", "Direct connection");
    }

    @Test
    void suggestsChannelByPreference() {
        assertThat(PathInsightAnalyzer.suggestChannel(edge("a", "b", 0.5, NOW, "call", "Email"))).isEqualTo("email");
        assertThat(PathInsightAnalyzer.suggestChannel(edge("a", "b", 0.5, NOW, "sms"))).isEqualTo("sms");
        assertThat(PathInsightAnalyzer.suggestChannel(edge("a", "b", 0.5, NOW))).isEqualTo("email");
    }

    @Test
    void rejectsPathWithoutEdges() {
        assertThatThrownBy(() -> analyzer.analyze(IntroPath.origin("me"), Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
