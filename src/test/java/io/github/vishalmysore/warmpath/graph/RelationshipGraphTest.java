package io.github.vishalmysore.warmpath.graph;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import io.github.vishalmysore.warmpath.domain.NodeAttributes;
import io.github.vishalmysore.warmpath.domain.PersonNode;
import io.github.vishalmysore.warmpath.domain.PersonRecord;
import io.github.vishalmysore.warmpath.domain.RelationshipEdge;
import io.github.vishalmysore.warmpath.domain.RelationshipRecord;

class RelationshipGraphTest {

    private static RelationshipGraph sampleGraph() {
        return new GraphBuilder().build(
                List.of(
                        PersonRecord.builder().id("a").displayNames(List.of("Ann")).attributes(NodeAttributes.selfNode()).build(),
                        PersonRecord.builder().id("b").displayNames(List.of("Ben", "Benjamin")).build(),
                        PersonRecord.builder().id("c").displayNames(List.of("Cy")).build(),
                        PersonRecord.builder().id("d").displayNames(List.of("Di")).build()),
                List.of(
                        RelationshipRecord.builder().fromId("a").toId("b").weight(0.9).build(),
                        RelationshipRecord.builder().fromId("b").toId("c").weight(0.5).build()));
    }

    @Test
    void summarizesConnections() {
        GraphStatistics stats = sampleGraph().statistics();

        assertThat(stats.getPersonCount()).isEqualTo(4);
        assertThat(stats.getRelationshipCount()).isEqualTo(2);
        assertThat(stats.getAverageConnections()).isEqualTo(1.0);
        assertThat(stats.getStrongConnections()).isEqualTo(1);
        assertThat(stats.getIsolatedPersons()).isEqualTo(1);
    }

    @Test
    void findsSelfNodeByMarker() {
        assertThat(sampleGraph().findSelfNode()).map(PersonNode::getId).contains("a");
    }

    @Test
    void hasNoSelfNodeWithoutMarker() {
        RelationshipGraph graph = new GraphBuilder().build(
                List.of(PersonRecord.builder().id("x").build()), List.of());

        assertThat(graph.findSelfNode()).isEmpty();
    }

    @Test
    void usesFirstDisplayNameAsNodeName() {
        Map<String, String> names = sampleGraph().nodeNames();

        assertThat(names).containsEntry("b", "Ben").containsEntry("a", "Ann");
    }

    @Test
    void listsEachRelationshipOnce() {
        assertThat(sampleGraph().getRelationships())
                .extracting(RelationshipEdge::getFromId, RelationshipEdge::getToId)
                .hasSize(2);
    }

    @Test
    void answersFrontierFromMemory() {
        RelationshipGraph graph = sampleGraph();

        FrontierBatch batch = graph.fetchFrontier(List.of("a", "b"));

        assertThat(batch.edgesOf("a")).extracting(RelationshipEdge::getToId).containsExactly("b");
        assertThat(batch.edgesOf("b")).extracting(RelationshipEdge::getToId).containsExactly("a", "c");
        assertThat(batch.getNeighbors()).containsOnlyKeys("a", "b", "c");
        assertThat(batch.edgesOf("unknown")).isEmpty();
    }

    @Test
    void fetchesOnlyKnownNodes() {
        assertThat(sampleGraph().fetchNodes(List.of("a", "zzz"))).containsOnlyKeys("a");
    }
}
