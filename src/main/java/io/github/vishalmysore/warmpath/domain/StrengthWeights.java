package io.github.vishalmysore.warmpath.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Weights of the strength factors. They must sum to 1.0.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class StrengthWeights {
    private static final double SUM_TOLERANCE = 0.001;

    public static final StrengthWeights DEFAULT = new StrengthWeights(0.35, 0.30, 0.20, 0.15);

    double recency;
    double frequency;
    double mutuality;
    double channels;

    public static StrengthWeights of(double recency, double frequency, double mutuality, double channels) {
        double sum = recency + frequency + mutuality + channels;
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new IllegalArgumentException("Weights must sum to 1.0, but got " + String.format("%.4f", sum));
        }
        return new StrengthWeights(recency, frequency, mutuality, channels);
    }
}
