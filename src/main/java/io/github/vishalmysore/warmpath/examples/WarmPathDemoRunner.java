package io.github.vishalmysore.warmpath.examples;

import io.github.vishalmysore.warmpath.domain.EntityResolutionMatch;
import io.github.vishalmysore.warmpath.domain.InteractionSignals;
import io.github.vishalmysore.warmpath.domain.NodeAttributes;
import io.github.vishalmysore.warmpath.domain.PathResult;
import io.github.vishalmysore.warmpath.domain.PersonProfile;
import io.github.vishalmysore.warmpath.domain.PersonRecord;
import io.github.vishalmysore.warmpath.domain.RankedPath;
import io.github.vishalmysore.warmpath.domain.RelationshipRecord;
import io.github.vishalmysore.warmpath.domain.StrengthAssessment;
import io.github.vishalmysore.warmpath.domain.TenantScope;
import io.github.vishalmysore.warmpath.graph.GraphBuilder;
import io.github.vishalmysore.warmpath.graph.InMemoryGraphDataProvider;
import io.github.vishalmysore.warmpath.graph.RelationshipGraph;
import io.github.vishalmysore.warmpath.jsonld.JsonLdExporter;
import io.github.vishalmysore.warmpath.resolution.EntityResolver;
import io.github.vishalmysore.warmpath.resolution.MergeExplanations;
import io.github.vishalmysore.warmpath.retrieval.PathInsightAnalyzer;
import io.github.vishalmysore.warmpath.retrieval.PathInsights;
import io.github.vishalmysore.warmpath.retrieval.Pathfinder;
import io.github.vishalmysore.warmpath.retrieval.PathfinderOptions;
import io.github.vishalmysore.warmpath.scoring.RelationshipStrengthScorer;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * End-to-end demonstration over an in-memory tenant:
 * 1. Edge weights from raw interaction history
 * 2. Graph construction and warm introduction pathfinding
 * 3. Path insights for the best route
 * 4. Duplicate detection among imported contacts
 * 5. JSON-LD export
 */
public class WarmPathDemoRunner {

    public static void main(String[] args) {
        System.out.println("=== WarmPath: warm introduction pathfinding demo ===\n");

        PathfinderOptions options = PathfinderOptions.loadDefaults();
        System.out.println("Options: maxHops=" + options.getMaxHops() + ", maxResults=" + options.getMaxResults()
                + ", minStrength=" + options.getMinStrength() + "\n");

        // === Phase 1: Relationship strength ===
        System.out.println("--- PHASE 1: RELATIONSHIP STRENGTH ---\n");

        Instant now = Instant.now();
        RelationshipStrengthScorer strengthScorer = new RelationshipStrengthScorer();
        StrengthAssessment meToAlice = strengthScorer.assess(InteractionSignals.builder()
                .firstSeenAt(now.minus(Duration.ofDays(400)))
                .lastSeenAt(now.minus(Duration.ofDays(3)))
                .interactionCount(160)
                .sentCount(80)
                .receivedCount(75)
                .channels(Set.of("email", "linkedin", "meeting"))
                .build());
        System.out.printf("me -> alice: strength %.3f (confidence %.2f), factors %s%n%n",
                meToAlice.getScore(), meToAlice.getConfidence(), meToAlice.getFactors());

        // === Phase 2: Pathfinding ===
        System.out.println("--- PHASE 2: PATHFINDING ---\n");

        TenantScope tenant = TenantScope.of("demo-tenant");
        InMemoryGraphDataProvider provider = buildSampleTenant(tenant, meToAlice.getScore(), now);

        RelationshipGraph graph = new GraphBuilder().build(provider, tenant);
        System.out.println("Graph: " + graph.statistics() + "\n");

        Pathfinder pathfinder = new Pathfinder();
        List<PathResult> results = pathfinder.findWarmIntroPaths(provider, tenant, null, "dave", options);
        printResults(results);

        System.out.println("\nSame search, one storage round trip per level:");
        printResults(pathfinder.findWarmIntroPathsBatched(provider, tenant, "me", "dave", options));

        // === Phase 3: Insights ===
        System.out.println("\n--- PHASE 3: PATH INSIGHTS ---\n");

        List<RankedPath> ranked = pathfinder.findRankedPaths(graph, "me", "dave", options);
        if (!ranked.isEmpty()) {
            PathInsights insights = new PathInsightAnalyzer(strengthScorer)
                    .analyze(ranked.get(0).getPath(), graph.nodeNames());
            System.out.println("Ask " + insights.getIntroducerName() + " via " + insights.getSuggestedChannel());
            System.out.println(insights.getReasons().isEmpty() ? "(no highlights)" : insights.reasoning());
        }

        // === Phase 4: Entity resolution ===
        System.out.println("\n--- PHASE 4: ENTITY RESOLUTION ---\n");

        PersonProfile target = PersonProfile.builder()
                .id("carol")
                .names(List.of("Carol Jones"))
                .emails(List.of("carol@acme.io"))
                .organizationName("Acme Corp")
                .build();
        List<PersonProfile> candidates = List.of(
                PersonProfile.builder().id("carol-linkedin").names(List.of("Carol Jones"))
                        .emails(List.of("carol@acme.io", "cj@gmail.com")).build(),
                PersonProfile.builder().id("carol-csv").names(List.of("Carol Jonas"))
                        .organizationName("Acme Corp.").build(),
                PersonProfile.builder().id("bob").names(List.of("Bob Brown")).build());

        List<EntityResolutionMatch> matches = new EntityResolver().findMatches(target, candidates);
        for (EntityResolutionMatch match : matches) {
            System.out.println(match.getCandidateId() + " [" + match.getRecommendation().getCode() + "] "
                    + MergeExplanations.explain(match));
        }

        // === Phase 5: JSON-LD ===
        System.out.println("\n--- PHASE 5: JSON-LD EXPORT ---\n");

        JsonLdExporter exporter = new JsonLdExporter();
        String pathsJsonLd = exporter.exportPathResults(results, "dave");
        System.out.println(pathsJsonLd.substring(0, Math.min(pathsJsonLd.length(), 800)) + "\n...\n");
        String matchesJsonLd = exporter.exportMatches(matches);
        System.out.println(matchesJsonLd.substring(0, Math.min(matchesJsonLd.length(), 600)) + "\n...\n");
        String graphJsonLd = exporter.exportGraph(graph);
        System.out.println("Graph document: " + graphJsonLd.length() + " characters");

        System.out.println("\n=== DEMO COMPLETE ===");
    }

    private static InMemoryGraphDataProvider buildSampleTenant(TenantScope tenant, double meToAlice, Instant now) {
        InMemoryGraphDataProvider provider = new InMemoryGraphDataProvider();
        provider.addPerson(tenant, person("me", "Me", NodeAttributes.selfNode()))
                .addPerson(tenant, person("alice", "Alice Smith", org("Globex", "Engineering Manager")))
                .addPerson(tenant, person("bob", "Bob Brown", org("Initech", "Founder")))
                .addPerson(tenant, person("carol", "Carol Jones", org("Acme Corp", "VP Sales")))
                .addPerson(tenant, person("dave", "Dave Miller", org("Acme Corp", "CTO")))
                .addPerson(tenant, person("erin", "Erin Stone", NodeAttributes.EMPTY));

        provider.addRelationship(tenant, relationship("me", "alice", meToAlice, now.minus(Duration.ofDays(3)),
                        "email", "linkedin", "meeting"))
                .addRelationship(tenant, relationship("me", "bob", 0.6, now.minus(Duration.ofDays(40)), "linkedin"))
                .addRelationship(tenant, relationship("alice", "carol", 0.8, now.minus(Duration.ofDays(10)), "email"))
                .addRelationship(tenant, relationship("bob", "carol", 0.7, now.minus(Duration.ofDays(120)), "call"))
                .addRelationship(tenant, relationship("carol", "dave", 0.85, now.minus(Duration.ofDays(5)),
                        "meeting", "email"))
                .addRelationship(tenant, relationship("alice", "dave", 0.5, now.minus(Duration.ofDays(300)),
                        "linkedin"))
                .addRelationship(tenant, relationship("me", "erin", 0.2, now.minus(Duration.ofDays(700)), "email"));
        return provider;
    }

    private static PersonRecord person(String id, String name, NodeAttributes attributes) {
        return PersonRecord.builder().id(id).displayNames(List.of(name)).attributes(attributes).build();
    }

    private static NodeAttributes org(String organization, String title) {
        return NodeAttributes.builder()
                .organizationName(organization)
                .title(title)
                .extensions(Map.of("source", "demo"))
                .build();
    }

    private static RelationshipRecord relationship(String from, String to, double weight, Instant lastInteraction,
                                                   String... channels) {
        return RelationshipRecord.builder()
                .fromId(from)
                .toId(to)
                .weight(weight)
                .channels(Set.of(channels))
                .lastInteractionAt(lastInteraction)
                .build();
    }

    private static void printResults(List<PathResult> results) {
        if (results.isEmpty()) {
            System.out.println("  No warm path found");
            return;
        }
        for (PathResult result : results) {
            System.out.printf("  #%d [%.3f] %s%n      %s%n", result.getRank(), result.getScore(),
                    String.join(" -> ", result.getPath()), result.getExplanation());
        }
    }
}
