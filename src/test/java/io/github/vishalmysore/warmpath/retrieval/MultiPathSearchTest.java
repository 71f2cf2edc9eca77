package io.github.vishalmysore.warmpath.retrieval;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import io.github.vishalmysore.warmpath.domain.IntroPath;
import io.github.vishalmysore.warmpath.domain.PersonNode;
import io.github.vishalmysore.warmpath.domain.PersonRecord;
import io.github.vishalmysore.warmpath.domain.RelationshipRecord;
import io.github.vishalmysore.warmpath.graph.FrontierBatch;
import io.github.vishalmysore.warmpath.graph.FrontierSource;
import io.github.vishalmysore.warmpath.graph.GraphBuilder;
import io.github.vishalmysore.warmpath.graph.RelationshipGraph;

class MultiPathSearchTest {

    private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");

    private final MultiPathSearch search = new MultiPathSearch(Clock.fixed(NOW, ZoneOffset.UTC));

    private static RelationshipGraph graph(List<String> ids, RelationshipRecord... relationships) {
        List<PersonRecord> persons = new ArrayList<>();
        ids.forEach(id -> persons.add(PersonRecord.builder().id(id).displayNames(List.of(id)).build()));
        return new GraphBuilder().build(persons, List.of(relationships));
    }

    private static RelationshipRecord rel(String from, String to, double weight) {
        return RelationshipRecord.builder().fromId(from).toId(to).weight(weight).build();
    }

    private static RelationshipGraph triangle() {
        return graph(List.of("A", "B", "C"), rel("A", "B", 0.9), rel("B", "C", 0.8), rel("A", "C", 0.6));
    }

    private static RelationshipGraph complete(int size) {
        List<String> ids = new ArrayList<>();
        List<RelationshipRecord> relationships = new ArrayList<>();
        for (int i = 1; i <= size; i++) {
            ids.add(String.valueOf(i));
            for (int j = 1; j < i; j++) {
                relationships.add(rel(String.valueOf(j), String.valueOf(i), 0.5));
            }
        }
        return graph(ids, relationships.toArray(new RelationshipRecord[0]));
    }

    @Test
    void findsDirectAndIndirectRoutes() {
        List<IntroPath> paths = search.search(triangle(), "A", "C", 2);

        assertThat(paths).extracting(IntroPath::getNodeIds)
                .containsExactlyInAnyOrder(List.of("A", "C"), List.of("A", "B", "C"));
    }

    @Test
    void respectsHopLimit() {
        List<IntroPath> paths = search.search(triangle(), "A", "C", 1);

        assertThat(paths).extracting(IntroPath::getNodeIds).containsExactly(List.of("A", "C"));
    }

    @Test
    void sameOrUnknownEndpointsYieldNothing() {
        RelationshipGraph graph = triangle();

        assertThat(search.search(graph, "A", "A", 3)).isEmpty();
        assertThat(search.search(graph, "A", "nonexistent", 3)).isEmpty();
        assertThat(search.search(graph, "nonexistent", "A", 3)).isEmpty();
        assertThat(search.search(graph, null, "A", 3)).isEmpty();
        assertThat(search.search(graph, "A", "C", 0)).isEmpty();
    }

    @Test
    void disconnectedTargetYieldsNothing() {
        RelationshipGraph graph = graph(List.of("A", "B", "C"), rel("A", "B", 0.9));

        assertThat(search.search(graph, "A", "C", 3)).isEmpty();
    }

    @Test
    void everyPathIsSimpleAndWithinHopLimit() {
        List<IntroPath> paths = search.search(complete(5), "1", "2", 3);

        // 1 direct, 3 via one intermediary, 3 * 2 via two
        assertThat(paths).hasSize(10);
        for (IntroPath path : paths) {
            assertThat(new HashSet<>(path.getNodeIds())).hasSameSizeAs(path.getNodeIds());
            assertThat(path.hopCount()).isLessThanOrEqualTo(3);
            assertThat(path.sourceId()).isEqualTo("1");
            assertThat(path.targetId()).isEqualTo("2");
            assertThat(path.intermediaryIds()).doesNotContain("2");
        }
    }

    @Test
    void prunesEdgesBelowMinimumWeight() {
        SearchOutcome outcome = search.run(triangle(), "A", "C",
                SearchLimits.builder().maxHops(2).minEdgeWeight(0.7).build());

        assertThat(outcome.getPaths()).extracting(IntroPath::getNodeIds).containsExactly(List.of("A", "B", "C"));
    }

    @Test
    void fetchesOneFrontierPerLevel() {
        RelationshipGraph graph = complete(5);
        AtomicInteger frontierCalls = new AtomicInteger();
        FrontierSource counting = new FrontierSource() {
            @Override
            public Map<String, PersonNode> fetchNodes(Collection<String> nodeIds) {
                return graph.fetchNodes(nodeIds);
            }

            @Override
            public FrontierBatch fetchFrontier(Collection<String> nodeIds) {
                frontierCalls.incrementAndGet();
                return graph.fetchFrontier(nodeIds);
            }
        };

        search.search(counting, "1", "2", 3);

        assertThat(frontierCalls).hasValue(3);
    }

    @Test
    void stopsOnExpansionBudgetWithPathsSoFar() {
        SearchOutcome outcome = search.run(triangle(), "A", "C",
                SearchLimits.builder().maxHops(2).maxExpansions(1).build());

        assertThat(outcome.isTruncated()).isTrue();
        assertThat(outcome.getExpansions()).isEqualTo(1);
        assertThat(outcome.getPaths()).extracting(IntroPath::getNodeIds).containsExactly(List.of("A", "C"));
    }

    @Test
    void stopsOnPassedDeadline() {
        SearchOutcome outcome = search.run(triangle(), "A", "C",
                SearchLimits.builder().maxHops(2).deadline(NOW.minus(Duration.ofSeconds(1))).build());

        assertThat(outcome.isTruncated()).isTrue();
        assertThat(outcome.getPaths()).isEmpty();
    }

    @Test
    void reportsNamesOfDiscoveredNodes() {
        SearchOutcome outcome = search.run(triangle(), "A", "C", SearchLimits.ofHops(2));

        assertThat(outcome.isTruncated()).isFalse();
        assertThat(outcome.nodeNames()).containsKeys("A", "B", "C");
    }
}
