package io.github.vishalmysore.warmpath.scoring;

import io.github.vishalmysore.warmpath.domain.InteractionSignals;
import io.github.vishalmysore.warmpath.domain.RelationshipStrengthFactors;
import io.github.vishalmysore.warmpath.domain.StrengthAssessment;
import io.github.vishalmysore.warmpath.domain.StrengthWeights;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns raw interaction history into a single relationship strength in [0,1].
 * The result is the weighted sum of four factors:
 * <ul>
 * <li>recency: exponential decay with a 90-day half-life</li>
 * <li>frequency: interactions per month, log-compressed</li>
 * <li>mutuality: balance of sent vs. received interactions</li>
 * <li>channels: step function of distinct channels used</li>
 * </ul>
 * The same scorer produces edge weights at import time and is used when
 * recomputing them after new interactions arrive.
 */
public class RelationshipStrengthScorer {

    public static final double HALF_LIFE_DAYS = 90.0;

    // Fallbacks for degenerate histories
    static final double SAME_DAY_FREQUENCY = 0.5;
    static final double ONE_WAY_MUTUALITY = 0.3;

    private static final double DAYS_PER_MONTH = 30.0;
    private static final double MILLIS_PER_DAY = 24.0 * 60 * 60 * 1000;
    private static final double CONFIDENT_RECENCY_DAYS = 365.0;

    private final Clock clock;
    private final StrengthWeights weights;

    public RelationshipStrengthScorer() {
        this(Clock.systemUTC(), StrengthWeights.DEFAULT);
    }

    public RelationshipStrengthScorer(Clock clock, StrengthWeights weights) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.weights = Objects.requireNonNull(weights, "weights");
    }

    /**
     * Weighted linear combination of the factors, clamped to [0,1].
     */
    public double calculateStrength(RelationshipStrengthFactors factors, StrengthWeights weights) {
        double score = factors.getRecency() * weights.getRecency()
                + factors.getFrequency() * weights.getFrequency()
                + factors.getMutuality() * weights.getMutuality()
                + factors.getChannels() * weights.getChannels();
        return clamp(score);
    }

    public double calculateStrength(RelationshipStrengthFactors factors) {
        return calculateStrength(factors, weights);
    }

    /**
     * Edge weight for a relationship, straight from its interaction history.
     */
    public double score(InteractionSignals signals) {
        return calculateStrength(calculateFactors(signals));
    }

    public RelationshipStrengthFactors calculateFactors(InteractionSignals signals) {
        return RelationshipStrengthFactors.builder()
                .recency(recencyFactor(signals.getLastSeenAt()))
                .frequency(frequencyFactor(signals.getInteractionCount(), signals.getFirstSeenAt(),
                        signals.getLastSeenAt()))
                .mutuality(mutualityFactor(signals.getSentCount(), signals.getReceivedCount()))
                .channels(channelsFactor(signals.getChannels()))
                .build();
    }

    /**
     * Score, factors and a data-completeness confidence for one relationship.
     */
    public StrengthAssessment assess(InteractionSignals signals) {
        RelationshipStrengthFactors factors = calculateFactors(signals);
        return StrengthAssessment.builder()
                .score(calculateStrength(factors))
                .factors(factors)
                .confidence(confidence(signals))
                .build();
    }

    /**
     * {@code exp(-ln2 * days / 90)}: 1.0 today, 0.5 after one half-life.
     * A timestamp in the future counts as today; no timestamp scores 0.
     */
    public double recencyFactor(Instant lastSeenAt) {
        if (lastSeenAt == null)
            return 0.0;
        double days = Math.max(0.0, daysBetween(lastSeenAt, clock.instant()));
        return Math.exp(-Math.log(2) * days / HALF_LIFE_DAYS);
    }

    /**
     * {@code min(1, log10(perMonth + 1) / log10(11))}, so ten interactions a
     * month saturate the factor.
     */
    public double frequencyFactor(long interactionCount, Instant firstSeenAt, Instant lastSeenAt) {
        requireNonNegative(interactionCount, "interactionCount");
        if (interactionCount == 0)
            return 0.0;
        if (firstSeenAt == null || lastSeenAt == null)
            return SAME_DAY_FREQUENCY;

        double days = daysBetween(firstSeenAt, lastSeenAt);
        if (days <= 0)
            return SAME_DAY_FREQUENCY;

        double perMonth = interactionCount / days * DAYS_PER_MONTH;
        return Math.min(1.0, Math.log10(perMonth + 1) / Math.log10(11));
    }

    /**
     * {@code 2 * min(sent, received) / (sent + received)}; 1.0 only at a
     * perfect 50/50 split. One-way traffic gets a fixed low value and no
     * traffic at all gets 0.
     */
    public double mutualityFactor(long sentCount, long receivedCount) {
        requireNonNegative(sentCount, "sentCount");
        requireNonNegative(receivedCount, "receivedCount");
        if (sentCount == 0 && receivedCount == 0)
            return 0.0;
        if (sentCount == 0 || receivedCount == 0)
            return ONE_WAY_MUTUALITY;
        return 2.0 * Math.min(sentCount, receivedCount) / (sentCount + receivedCount);
    }

    /**
     * 0 channels → 0, 1 → 0.4, 2 → 0.7, 3 or more → 1.0. Channel names are
     * compared case-insensitively.
     */
    public double channelsFactor(Collection<String> channels) {
        int count = distinctChannels(channels).size();
        if (count == 0)
            return 0.0;
        if (count == 1)
            return 0.4;
        if (count == 2)
            return 0.7;
        return 1.0;
    }

    private double confidence(InteractionSignals signals) {
        int present = 0;
        if (signals.getInteractionCount() > 0)
            present++;
        if (signals.getSentCount() > 0 || signals.getReceivedCount() > 0)
            present++;
        if (!distinctChannels(signals.getChannels()).isEmpty())
            present++;
        if (signals.getLastSeenAt() != null
                && daysBetween(signals.getLastSeenAt(), clock.instant()) < CONFIDENT_RECENCY_DAYS)
            present++;

        double base = present / 4.0;
        double volumeBoost = Math.min(0.2, signals.getInteractionCount() / 100.0);
        return Math.min(1.0, base + volumeBoost);
    }

    private static Set<String> distinctChannels(Collection<String> channels) {
        if (channels == null)
            return Set.of();
        return channels.stream()
                .filter(Objects::nonNull)
                .map(c -> c.trim().toLowerCase(Locale.ROOT))
                .filter(c -> !c.isEmpty())
                .collect(Collectors.toSet());
    }

    private static double daysBetween(Instant from, Instant to) {
        return Duration.between(from, to).toMillis() / MILLIS_PER_DAY;
    }

    private static void requireNonNegative(long value, String name) {
        if (value < 0)
            throw new IllegalArgumentException(name + " must be non-negative, got " + value);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
