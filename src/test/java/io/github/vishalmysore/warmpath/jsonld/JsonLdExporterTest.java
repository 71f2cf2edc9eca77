package io.github.vishalmysore.warmpath.jsonld;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.vishalmysore.warmpath.domain.EntityResolutionMatch;
import io.github.vishalmysore.warmpath.domain.MatchEvidence;
import io.github.vishalmysore.warmpath.domain.MatchMethod;
import io.github.vishalmysore.warmpath.domain.MatchRecommendation;
import io.github.vishalmysore.warmpath.domain.NodeAttributes;
import io.github.vishalmysore.warmpath.domain.PathResult;
import io.github.vishalmysore.warmpath.domain.PersonRecord;
import io.github.vishalmysore.warmpath.domain.RelationshipRecord;
import io.github.vishalmysore.warmpath.graph.GraphBuilder;
import io.github.vishalmysore.warmpath.graph.RelationshipGraph;

class JsonLdExporterTest {

    private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");

    private final JsonLdExporter exporter = new JsonLdExporter(Clock.fixed(NOW, ZoneOffset.UTC));
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void exportsPathResults() throws Exception {
        PathResult result = PathResult.builder()
                .path(List.of("me", "bob", "dave"))
                .score(0.648)
                .rank(1)
                .explanation("Connect through Bob to reach Dave (moderate path)")
                .build();

        JsonNode doc = mapper.readTree(exporter.exportPathResults(List.of(result), "dave"));

        assertThat(doc.get("@type").asText()).isEqualTo("warmpath:IntroductionPathResult");
        assertThat(doc.get("warmpath:target").get("@id").asText()).isEqualTo("urn:warmpath:person:dave");
        assertThat(doc.get("warmpath:generatedAt").asText()).isEqualTo("2024-06-01T00:00:00Z");
        JsonNode path = doc.get("@graph").get(0);
        assertThat(path.get("warmpath:rank").asInt()).isEqualTo(1);
        assertThat(path.get("warmpath:hops")).hasSize(3);
        assertThat(path.get("warmpath:hops").get(1).get("@id").asText()).isEqualTo("urn:warmpath:person:bob");
    }

    @Test
    void exportsMatchesWithWireCodes() throws Exception {
        EntityResolutionMatch match = EntityResolutionMatch.builder()
                .targetId("x").candidateId("y")
                .matchScore(1.0)
                .matchMethod(MatchMethod.SOCIAL_HANDLE)
                .evidence(List.of(MatchEvidence.of("socialHandle.linkedin", "cj", "cj", 1.0)))
                .recommendation(MatchRecommendation.AUTO_MERGE)
                .build();

        JsonNode doc = mapper.readTree(exporter.exportMatches(List.of(match)));

        JsonNode item = doc.get("@graph").get(0);
        assertThat(item.get("warmpath:matchMethod").asText()).isEqualTo("social_handle");
        assertThat(item.get("warmpath:recommendation").asText()).isEqualTo("auto_merge");
        assertThat(item.get("sameAs").asText()).isEqualTo("urn:warmpath:person:y");
        assertThat(item.get("warmpath:evidence").get(0).get("field").asText()).isEqualTo("socialHandle.linkedin");
    }

    @Test
    void exportsGraphWithStatistics() throws Exception {
        RelationshipGraph graph = new GraphBuilder().build(
                List.of(
                        PersonRecord.builder().id("me").displayNames(List.of("Me"))
                                .attributes(NodeAttributes.selfNode()).build(),
                        PersonRecord.builder().id("bob").displayNames(List.of("Bob"))
                                .attributes(NodeAttributes.builder().organizationName("Initech").build()).build()),
                List.of(RelationshipRecord.builder().fromId("me").toId("bob").weight(0.8)
                        .lastInteractionAt(NOW).build()));

        JsonNode doc = mapper.readTree(exporter.exportGraph(graph));

        assertThat(doc.get("@graph")).hasSize(3);
        assertThat(doc.get("@graph").get(0).get("warmpath:searchOrigin").asBoolean()).isTrue();
        assertThat(doc.get("@graph").get(1).get("worksFor").get("name").asText()).isEqualTo("Initech");
        assertThat(doc.get("@graph").get(2).get("weight").asDouble()).isEqualTo(0.8);
        assertThat(doc.get("warmpath:statistics").get("personCount").asInt()).isEqualTo(2);
        assertThat(doc.get("warmpath:statistics").get("relationshipCount").asInt()).isEqualTo(1);
    }
}
