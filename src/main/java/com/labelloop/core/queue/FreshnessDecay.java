package com.labelloop.core.queue;

import java.time.Duration;

/**
 * Wait-time multiplier for task priority.
 * <pre>
 *   decay(w) = 1 + (maxBoost - 1) * (1 - e^(-w / tau))
 * </pre>
 * Starts at 1 for a fresh task, rises strictly with wait time and never exceeds
 * {@code maxBoost}, so old tasks cannot starve but cannot dominate forever either.
 */
public final class FreshnessDecay {

    private final double maxBoost;
    private final double tauMillis;

    public FreshnessDecay(double maxBoost, Duration timeConstant) {
        if (maxBoost <= 1.0) {
            throw new IllegalArgumentException("maxBoost must be greater than 1, was " + maxBoost);
        }
        if (timeConstant.isNegative() || timeConstant.isZero()) {
            throw new IllegalArgumentException("time constant must be positive, was " + timeConstant);
        }
        this.maxBoost = maxBoost;
        this.tauMillis = timeConstant.toMillis();
    }

    public double multiplier(Duration waitTime) {
        double waited = Math.max(0L, waitTime.toMillis());
        return 1.0 + (maxBoost - 1.0) * -Math.expm1(-waited / tauMillis);
    }

    public double maxBoost() {
        return maxBoost;
    }

    /** {@code uncertainty * difficulty * decay(wait)}. */
    public double priority(double uncertainty, double difficulty, Duration waitTime) {
        return uncertainty * difficulty * multiplier(waitTime);
    }
}
