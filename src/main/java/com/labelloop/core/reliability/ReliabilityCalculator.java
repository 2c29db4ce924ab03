package com.labelloop.core.reliability;

/**
 * Reliability as a smoothed agreement rate:
 * <pre>
 *   reliability = (agreements + s * prior) / (agreements + disagreements + s)
 * </pre>
 * A pure function of the counts. With no history it returns the prior; with {@code s > 0}
 * and {@code prior > 0} it never reaches 0, so early disagreements cannot zero a new
 * annotator. The result is always in [0, 1].
 */
public final class ReliabilityCalculator {

    private final double prior;
    private final double smoothingConstant;

    public ReliabilityCalculator(double prior, double smoothingConstant) {
        if (prior < 0.0 || prior > 1.0) {
            throw new IllegalArgumentException("prior must be within [0, 1], was " + prior);
        }
        if (smoothingConstant <= 0.0) {
            throw new IllegalArgumentException("smoothing constant must be positive, was " + smoothingConstant);
        }
        this.prior = prior;
        this.smoothingConstant = smoothingConstant;
    }

    public double reliability(long agreements, long disagreements) {
        if (agreements < 0 || disagreements < 0) {
            throw new IllegalArgumentException("counts must not be negative: " + agreements + "/" + disagreements);
        }
        double score = (agreements + smoothingConstant * prior) / (agreements + disagreements + smoothingConstant);
        return Math.max(0.0, Math.min(1.0, score));
    }

    public double prior() {
        return prior;
    }

    public double smoothingConstant() {
        return smoothingConstant;
    }
}
