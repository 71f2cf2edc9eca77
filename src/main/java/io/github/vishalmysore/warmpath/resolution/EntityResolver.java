package io.github.vishalmysore.warmpath.resolution;

import io.github.vishalmysore.warmpath.domain.EntityResolutionMatch;
import io.github.vishalmysore.warmpath.domain.MatchEvidence;
import io.github.vishalmysore.warmpath.domain.MatchMethod;
import io.github.vishalmysore.warmpath.domain.MatchRecommendation;
import io.github.vishalmysore.warmpath.domain.PersonProfile;
import io.github.vishalmysore.warmpath.similarity.LevenshteinSimilarityProvider;
import io.github.vishalmysore.warmpath.similarity.SimilarityProvider;

import java.util.*;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Layered duplicate detection for person records. Each candidate is checked
 * against the target in strict priority order and the first layer that
 * matches wins:
 * <ol>
 * <li>shared email address</li>
 * <li>shared phone number</li>
 * <li>same handle on the same social platform</li>
 * <li>similar name plus similar organization</li>
 * </ol>
 * So a pair never yields more than one match, and the most reliable
 * evidence is the one reported.
 */
public class EntityResolver {
    private static final Logger log = Logger.getLogger(EntityResolver.class.getName());

    static final double SOCIAL_HANDLE_SCORE = 0.95;
    static final double NAME_THRESHOLD = 0.85;
    static final double NAME_ONLY_THRESHOLD = 0.95;
    static final double ORGANIZATION_THRESHOLD = 0.80;
    static final double AUTO_MERGE_THRESHOLD = 0.95;
    static final double REVIEW_THRESHOLD = 0.88;

    private final SimilarityProvider similarityProvider;

    public EntityResolver() {
        this(new LevenshteinSimilarityProvider());
    }

    public EntityResolver(SimilarityProvider similarityProvider) {
        this.similarityProvider = Objects.requireNonNull(similarityProvider, "similarityProvider");
        log.info("EntityResolver initialized with similarity provider: " + similarityProvider.getName());
    }

    /**
     * All candidates that look like the same individual as {@code target},
     * best match first. The target itself and soft-deleted candidates are
     * skipped. Matches recommended for rejection are still returned.
     */
    public List<EntityResolutionMatch> findMatches(PersonProfile target, Collection<PersonProfile> candidates) {
        Objects.requireNonNull(target, "target");
        List<EntityResolutionMatch> matches = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (PersonProfile candidate : candidates) {
            if (candidate == null || Objects.equals(target.getId(), candidate.getId()))
                continue;
            if (candidate.isDeleted())
                continue;
            if (candidate.getId() != null && !seen.add(candidate.getId()))
                continue;

            matchCandidate(target, candidate).ifPresent(matches::add);
        }

        matches.sort(Comparator.comparingDouble(EntityResolutionMatch::getMatchScore).reversed());
        log.info("Entity resolution for " + target.getId() + ": " + matches.size() + " matches among "
                + candidates.size() + " candidates");
        return matches;
    }

    /**
     * Runs the layers in priority order and stops at the first hit.
     */
    public Optional<EntityResolutionMatch> matchCandidate(PersonProfile target, PersonProfile candidate) {
        return matchByEmail(target, candidate)
                .or(() -> matchByPhone(target, candidate))
                .or(() -> matchBySocialHandle(target, candidate))
                .or(() -> matchByNameAndOrganization(target, candidate));
    }

    public Optional<EntityResolutionMatch> matchByEmail(PersonProfile target, PersonProfile candidate) {
        List<String> shared = sharedValues(target.getEmails(), candidate.getEmails());
        if (shared.isEmpty())
            return Optional.empty();

        return Optional.of(EntityResolutionMatch.builder()
                .targetId(target.getId())
                .candidateId(candidate.getId())
                .matchScore(1.0)
                .matchMethod(MatchMethod.EMAIL)
                .evidence(exactEvidence("email", shared))
                .recommendation(MatchRecommendation.AUTO_MERGE)
                .build());
    }

    public Optional<EntityResolutionMatch> matchByPhone(PersonProfile target, PersonProfile candidate) {
        List<String> shared = sharedValues(target.getPhones(), candidate.getPhones());
        if (shared.isEmpty())
            return Optional.empty();

        return Optional.of(EntityResolutionMatch.builder()
                .targetId(target.getId())
                .candidateId(candidate.getId())
                .matchScore(1.0)
                .matchMethod(MatchMethod.PHONE)
                .evidence(exactEvidence("phone", shared))
                .recommendation(MatchRecommendation.AUTO_MERGE)
                .build());
    }

    public Optional<EntityResolutionMatch> matchBySocialHandle(PersonProfile target, PersonProfile candidate) {
        Map<String, String> targetHandles = target.getSocialHandles();
        Map<String, String> candidateHandles = candidate.getSocialHandles();
        if (targetHandles == null || candidateHandles == null)
            return Optional.empty();

        List<MatchEvidence> evidence = new ArrayList<>();
        for (Map.Entry<String, String> handle : new TreeMap<>(targetHandles).entrySet()) {
            String value = handle.getValue();
            if (value != null && value.equals(candidateHandles.get(handle.getKey()))) {
                evidence.add(MatchEvidence.of("socialHandle." + handle.getKey(), value, value, 1.0));
            }
        }
        if (evidence.isEmpty())
            return Optional.empty();

        return Optional.of(EntityResolutionMatch.builder()
                .targetId(target.getId())
                .candidateId(candidate.getId())
                .matchScore(SOCIAL_HANDLE_SCORE)
                .matchMethod(MatchMethod.SOCIAL_HANDLE)
                .evidence(evidence)
                .recommendation(MatchRecommendation.AUTO_MERGE)
                .build());
    }

    /**
     * Fuzzy layer. Names must be at least 0.85 similar. Without organization
     * data on both sides, only a near-identical name (0.95) qualifies and it
     * is never auto-merged. With organizations, both must be at least 0.80
     * similar and the average decides the recommendation.
     */
    public Optional<EntityResolutionMatch> matchByNameAndOrganization(PersonProfile target, PersonProfile candidate) {
        String bestTargetName = null;
        String bestCandidateName = null;
        double bestNameSimilarity = 0.0;
        for (String targetName : nullSafe(target.getNames())) {
            for (String candidateName : nullSafe(candidate.getNames())) {
                double similarity = similarityProvider.computeSimilarity(targetName, candidateName);
                if (similarity > bestNameSimilarity) {
                    bestNameSimilarity = similarity;
                    bestTargetName = targetName;
                    bestCandidateName = candidateName;
                }
            }
        }
        if (bestNameSimilarity < NAME_THRESHOLD)
            return Optional.empty();

        MatchEvidence nameEvidence = MatchEvidence.of("name", bestTargetName, bestCandidateName, bestNameSimilarity);

        if (!target.hasOrganization() || !candidate.hasOrganization()) {
            if (bestNameSimilarity < NAME_ONLY_THRESHOLD)
                return Optional.empty();
            return Optional.of(EntityResolutionMatch.builder()
                    .targetId(target.getId())
                    .candidateId(candidate.getId())
                    .matchScore(bestNameSimilarity)
                    .matchMethod(MatchMethod.NAME_AND_ORGANIZATION)
                    .evidence(List.of(nameEvidence))
                    .recommendation(MatchRecommendation.REVIEW_QUEUE)
                    .build());
        }

        double organizationSimilarity = similarityProvider.computeSimilarity(
                target.getOrganizationName(), candidate.getOrganizationName());
        if (organizationSimilarity < ORGANIZATION_THRESHOLD)
            return Optional.empty();

        double score = (bestNameSimilarity + organizationSimilarity) / 2.0;
        return Optional.of(EntityResolutionMatch.builder()
                .targetId(target.getId())
                .candidateId(candidate.getId())
                .matchScore(score)
                .matchMethod(MatchMethod.NAME_AND_ORGANIZATION)
                .evidence(List.of(nameEvidence, MatchEvidence.of("organization", target.getOrganizationName(),
                        candidate.getOrganizationName(), organizationSimilarity)))
                .recommendation(recommend(score))
                .build());
    }

    static MatchRecommendation recommend(double score) {
        if (score >= AUTO_MERGE_THRESHOLD)
            return MatchRecommendation.AUTO_MERGE;
        if (score >= REVIEW_THRESHOLD)
            return MatchRecommendation.REVIEW_QUEUE;
        return MatchRecommendation.REJECT;
    }

    private static List<String> sharedValues(List<String> targetValues, List<String> candidateValues) {
        if (targetValues == null || candidateValues == null)
            return List.of();
        Set<String> candidateSet = new HashSet<>(candidateValues);
        return targetValues.stream()
                .filter(Objects::nonNull)
                .filter(candidateSet::contains)
                .distinct()
                .collect(Collectors.toList());
    }

    private static List<MatchEvidence> exactEvidence(String field, List<String> values) {
        return values.stream()
                .map(value -> MatchEvidence.of(field, value, value, 1.0))
                .collect(Collectors.toList());
    }

    private static List<String> nullSafe(List<String> values) {
        return values == null ? List.of() : values;
    }
}
