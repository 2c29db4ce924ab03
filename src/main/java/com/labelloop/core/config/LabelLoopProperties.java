package com.labelloop.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Tunables for the labeling engine, bound from {@code labelloop.*}.
 */
@Component
@ConfigurationProperties(prefix = "labelloop")
public class LabelLoopProperties {

    private Queue queue = new Queue();
    private Assignment assignment = new Assignment();
    private Consensus consensus = new Consensus();
    private Reliability reliability = new Reliability();
    private Retraining retraining = new Retraining();
    private Stall stall = new Stall();
    private Sweep sweep = new Sweep();

    public Queue getQueue() { return queue; }
    public void setQueue(Queue queue) { this.queue = queue; }
    public Assignment getAssignment() { return assignment; }
    public void setAssignment(Assignment assignment) { this.assignment = assignment; }
    public Consensus getConsensus() { return consensus; }
    public void setConsensus(Consensus consensus) { this.consensus = consensus; }
    public Reliability getReliability() { return reliability; }
    public void setReliability(Reliability reliability) { this.reliability = reliability; }
    public Retraining getRetraining() { return retraining; }
    public void setRetraining(Retraining retraining) { this.retraining = retraining; }
    public Stall getStall() { return stall; }
    public void setStall(Stall stall) { this.stall = stall; }
    public Sweep getSweep() { return sweep; }
    public void setSweep(Sweep sweep) { this.sweep = sweep; }

    public static class Queue {
        private double defaultDifficulty = 0.5;
        /** Upper bound of the freshness multiplier a long-waiting task can reach. */
        private double maxFreshnessBoost = 2.0;
        /** Wait time after which about 63% of the boost has been applied. */
        private Duration freshnessTimeConstant = Duration.ofMinutes(10);

        public double getDefaultDifficulty() { return defaultDifficulty; }
        public void setDefaultDifficulty(double defaultDifficulty) { this.defaultDifficulty = defaultDifficulty; }
        public double getMaxFreshnessBoost() { return maxFreshnessBoost; }
        public void setMaxFreshnessBoost(double maxFreshnessBoost) { this.maxFreshnessBoost = maxFreshnessBoost; }
        public Duration getFreshnessTimeConstant() { return freshnessTimeConstant; }
        public void setFreshnessTimeConstant(Duration freshnessTimeConstant) { this.freshnessTimeConstant = freshnessTimeConstant; }
    }

    public static class Assignment {
        private int maxConcurrentTasks = 3;
        private Duration timeout = Duration.ofMinutes(30);
        /** Attempts before giving up when concurrent callers keep winning the claim race. */
        private int maxClaimAttempts = 8;

        public int getMaxConcurrentTasks() { return maxConcurrentTasks; }
        public void setMaxConcurrentTasks(int maxConcurrentTasks) { this.maxConcurrentTasks = maxConcurrentTasks; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
        public int getMaxClaimAttempts() { return maxClaimAttempts; }
        public void setMaxClaimAttempts(int maxClaimAttempts) { this.maxClaimAttempts = maxClaimAttempts; }
    }

    public static class Consensus {
        private int minAnnotations = 2;
        private int minVotes = 3;
        private double agreementThreshold = 0.66;
        private Duration maxVotingWindow = Duration.ofHours(2);
        /** Weight of the agreement ratio in the confidence blend; the rest goes to voter reliability. */
        private double agreementWeight = 0.5;

        public int getMinAnnotations() { return minAnnotations; }
        public void setMinAnnotations(int minAnnotations) { this.minAnnotations = minAnnotations; }
        public int getMinVotes() { return minVotes; }
        public void setMinVotes(int minVotes) { this.minVotes = minVotes; }
        public double getAgreementThreshold() { return agreementThreshold; }
        public void setAgreementThreshold(double agreementThreshold) { this.agreementThreshold = agreementThreshold; }
        public Duration getMaxVotingWindow() { return maxVotingWindow; }
        public void setMaxVotingWindow(Duration maxVotingWindow) { this.maxVotingWindow = maxVotingWindow; }
        public double getAgreementWeight() { return agreementWeight; }
        public void setAgreementWeight(double agreementWeight) { this.agreementWeight = agreementWeight; }
    }

    public static class Reliability {
        private double prior = 0.5;
        private double smoothingConstant = 1.0;

        public double getPrior() { return prior; }
        public void setPrior(double prior) { this.prior = prior; }
        public double getSmoothingConstant() { return smoothingConstant; }
        public void setSmoothingConstant(double smoothingConstant) { this.smoothingConstant = smoothingConstant; }
    }

    public static class Retraining {
        private int batchSize = 10;
        private Duration maxBatchAge = Duration.ofHours(1);
        private Duration ackTimeout = Duration.ofMinutes(15);

        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }
        public Duration getMaxBatchAge() { return maxBatchAge; }
        public void setMaxBatchAge(Duration maxBatchAge) { this.maxBatchAge = maxBatchAge; }
        public Duration getAckTimeout() { return ackTimeout; }
        public void setAckTimeout(Duration ackTimeout) { this.ackTimeout = ackTimeout; }
    }

    public static class Stall {
        private int maxRetries = 3;

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    }

    public static class Sweep {
        private boolean enabled = true;
        private Duration interval = Duration.ofSeconds(30);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }
    }
}
