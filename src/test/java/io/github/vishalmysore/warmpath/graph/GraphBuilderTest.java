package io.github.vishalmysore.warmpath.graph;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import io.github.vishalmysore.warmpath.domain.PersonRecord;
import io.github.vishalmysore.warmpath.domain.RelationshipEdge;
import io.github.vishalmysore.warmpath.domain.RelationshipRecord;
import io.github.vishalmysore.warmpath.domain.TenantScope;

class GraphBuilderTest {

    private final GraphBuilder builder = new GraphBuilder();

    private static PersonRecord person(String id) {
        return PersonRecord.builder().id(id).displayNames(List.of(id.toUpperCase())).build();
    }

    private static RelationshipRecord relationship(String from, String to, Double weight) {
        return RelationshipRecord.builder().fromId(from).toId(to).weight(weight).build();
    }

    @Test
    void insertsEveryRelationshipInBothDirections() {
        RelationshipGraph graph = builder.build(List.of(person("a"), person("b")),
                List.of(relationship("a", "b", 0.9)));

        assertThat(graph.getEdges("a")).extracting(RelationshipEdge::getToId).containsExactly("b");
        assertThat(graph.getEdges("b")).extracting(RelationshipEdge::getToId).containsExactly("a");
        assertThat(graph.getEdges("b").get(0).getWeight()).isEqualTo(0.9);
        assertThat(graph.getEdgeCount()).isEqualTo(2);
    }

    @Test
    void dropsRecordsWithUnknownEndpointsAndSelfLoops() {
        RelationshipGraph graph = builder.build(List.of(person("a"), person("b")),
                List.of(relationship("a", "ghost", 0.9), relationship("a", "a", 0.5), relationship("a", "b", 0.4)));

        assertThat(graph.getEdgeCount()).isEqualTo(2);
        assertThat(graph.getNodeCount()).isEqualTo(2);
        assertThat(graph.containsNode("ghost")).isFalse();
    }

    @Test
    void collapsesParallelRecordsIntoStrongestEdge() {
        Instant older = Instant.parse("2024-01-01T00:00:00Z");
        Instant newer = Instant.parse("2024-05-01T00:00:00Z");
        RelationshipRecord first = RelationshipRecord.builder()
                .fromId("a").toId("b").weight(0.4).channels(Set.of("email")).lastInteractionAt(newer).build();
        RelationshipRecord second = RelationshipRecord.builder()
                .fromId("b").toId("a").weight(0.7).channels(Set.of("call")).lastInteractionAt(older).build();

        RelationshipGraph graph = builder.build(List.of(person("a"), person("b")), List.of(first, second));

        assertThat(graph.getEdges("a")).hasSize(1);
        RelationshipEdge edge = graph.getEdges("a").get(0);
        assertThat(edge.getWeight()).isEqualTo(0.7);
        assertThat(edge.getChannels()).containsExactlyInAnyOrder("email", "call");
        assertThat(edge.getLastInteractionAt()).isEqualTo(newer);
        assertThat(graph.getEdges("b")).hasSize(1);
    }

    @Test
    void parallelMergeKeepsWeightWhenOtherRecordIsUnscored() {
        RelationshipEdge scored = relationship("a", "b", 0.6).toEdge();
        RelationshipEdge unscored = relationship("a", "b", null).toEdge();

        assertThat(GraphBuilder.mergeParallel(unscored, scored).getWeight()).isEqualTo(0.6);
        assertThat(GraphBuilder.mergeParallel(scored, unscored).getWeight()).isEqualTo(0.6);
    }

    @Test
    void skipsPersonsWithoutId() {
        RelationshipGraph graph = builder.build(List.of(person("a"), PersonRecord.builder().build()), List.of());

        assertThat(graph.getNodeCount()).isEqualTo(1);
    }

    @Test
    void namesFallBackToUnknown() {
        RelationshipGraph graph = builder.build(List.of(PersonRecord.builder().id("x").build()), List.of());

        assertThat(graph.getNode("x").getDisplayName()).isEqualTo("Unknown");
    }

    @Test
    void blankOrNullFirstNameFallsBackToUnknown() {
        RelationshipGraph graph = builder.build(List.of(
                PersonRecord.builder().id("blank").displayNames(List.of("  ", "Later Name")).build(),
                PersonRecord.builder().id("null").displayNames(Arrays.asList(null, "Later Name")).build()),
                List.of());

        assertThat(graph.getNode("blank").getDisplayName()).isEqualTo("Unknown");
        assertThat(graph.getNode("null").getDisplayName()).isEqualTo("Unknown");
    }

    @Test
    void buildsFromProviderForOneTenant() {
        TenantScope scope = TenantScope.of("t1");
        GraphDataProvider provider = mock(GraphDataProvider.class);
        when(provider.listPersons(scope)).thenReturn(List.of(person("a"), person("b")));
        when(provider.listRelationships(scope)).thenReturn(List.of(relationship("a", "b", 0.5)));

        RelationshipGraph graph = builder.build(provider, scope);

        assertThat(graph.getNodeCount()).isEqualTo(2);
        assertThat(graph.getNeighbors("a")).extracting("id").containsExactly("b");
    }
}
