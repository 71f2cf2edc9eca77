package io.github.vishalmysore.warmpath.jsonld;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.vishalmysore.warmpath.domain.EntityResolutionMatch;
import io.github.vishalmysore.warmpath.domain.MatchEvidence;
import io.github.vishalmysore.warmpath.domain.PathResult;
import io.github.vishalmysore.warmpath.domain.PersonNode;
import io.github.vishalmysore.warmpath.domain.RelationshipEdge;
import io.github.vishalmysore.warmpath.graph.RelationshipGraph;

import java.time.Clock;
import java.util.*;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Exports relationship graphs, introduction paths and resolution matches as
 * JSON-LD documents using schema.org vocabulary plus a small warmpath
 * ontology, so results can be handed to knowledge graph tooling.
 */
public class JsonLdExporter {
    private static final Logger log = Logger.getLogger(JsonLdExporter.class.getName());
    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    static final String PERSON_PREFIX = "urn:warmpath:person:";

    private final Clock clock;

    public JsonLdExporter() {
        this(Clock.systemUTC());
    }

    public JsonLdExporter(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Export the full graph, one entry per person and per relationship.
     */
    public String exportGraph(RelationshipGraph graph) {
        try {
            return mapper.writeValueAsString(buildGraphDocument(graph));
        } catch (Exception e) {
            log.severe("Failed to export graph as JSON-LD: " + e.getMessage());
            return "{}";
        }
    }

    private Map<String, Object> buildGraphDocument(RelationshipGraph graph) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("@context", context());
        doc.put("@type", "warmpath:RelationshipGraph");

        List<Map<String, Object>> graphItems = new ArrayList<>();
        for (PersonNode node : graph.getAllNodes()) {
            graphItems.add(node.toJsonLd());
        }
        for (RelationshipEdge edge : graph.getRelationships()) {
            graphItems.add(edge.toJsonLd());
        }
        doc.put("@graph", graphItems);

        // GraphStatistics is a plain value object, Jackson serializes its getters
        doc.put("warmpath:statistics", graph.statistics());
        return doc;
    }

    /**
     * Export ranked introduction paths to one target.
     */
    public String exportPathResults(List<PathResult> results, String targetId) {
        try {
            Map<String, Object> doc = new LinkedHashMap<>();
            doc.put("@context", context());
            doc.put("@type", "warmpath:IntroductionPathResult");
            doc.put("warmpath:target", Map.of("@id", PERSON_PREFIX + targetId));
            doc.put("warmpath:generatedAt", clock.instant());
            doc.put("warmpath:resultCount", results.size());
            doc.put("@graph", results.stream()
                    .map(JsonLdExporter::pathToJsonLd)
                    .collect(Collectors.toList()));
            return mapper.writeValueAsString(doc);
        } catch (Exception e) {
            log.severe("Failed to export path results: " + e.getMessage());
            return "{}";
        }
    }

    /**
     * Export entity resolution matches for a review workflow. Method and
     * recommendation use their wire codes.
     */
    public String exportMatches(List<EntityResolutionMatch> matches) {
        try {
            Map<String, Object> doc = new LinkedHashMap<>();
            doc.put("@context", context());
            doc.put("@type", "warmpath:EntityResolutionResult");
            doc.put("warmpath:matchCount", matches.size());
            doc.put("@graph", matches.stream()
                    .map(JsonLdExporter::matchToJsonLd)
                    .collect(Collectors.toList()));
            return mapper.writeValueAsString(doc);
        } catch (Exception e) {
            log.severe("Failed to export resolution matches: " + e.getMessage());
            return "{}";
        }
    }

    private static Map<String, Object> context() {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("schema", "https://schema.org/");
        context.put("warmpath", "urn:warmpath:ontology:");
        context.put("name", "schema:name");
        context.put("worksFor", "schema:worksFor");
        context.put("jobTitle", "schema:jobTitle");
        context.put("knows", Map.of("@id", "schema:knows", "@type", "@id"));
        context.put("sameAs", Map.of("@id", "schema:sameAs", "@type", "@id"));
        return context;
    }

    private static Map<String, Object> pathToJsonLd(PathResult result) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("@type", "warmpath:IntroductionPath");
        item.put("warmpath:rank", result.getRank());
        item.put("warmpath:score", result.getScore());
        item.put("warmpath:hops", result.getPath().stream()
                .map(id -> Map.of("@id", PERSON_PREFIX + id))
                .collect(Collectors.toList()));
        item.put("schema:description", result.getExplanation());
        return item;
    }

    private static Map<String, Object> matchToJsonLd(EntityResolutionMatch match) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("@type", "warmpath:ResolutionMatch");
        item.put("@id", PERSON_PREFIX + match.getTargetId());
        item.put("sameAs", PERSON_PREFIX + match.getCandidateId());
        item.put("warmpath:matchScore", match.getMatchScore());
        item.put("warmpath:matchMethod", match.getMatchMethod());
        item.put("warmpath:recommendation", match.getRecommendation());
        List<Map<String, Object>> evidence = new ArrayList<>();
        for (MatchEvidence e : match.getEvidence()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("field", e.getField());
            entry.put("targetValue", e.getTargetValue());
            entry.put("candidateValue", e.getCandidateValue());
            entry.put("similarity", e.getSimilarity());
            evidence.add(entry);
        }
        item.put("warmpath:evidence", evidence);
        return item;
    }
}
