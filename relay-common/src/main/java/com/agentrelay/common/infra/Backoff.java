package com.agentrelay.common.infra;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential reconnect backoff with downward jitter.
 */
public final class Backoff {

    private Backoff() {
    }

    /**
     * Backoff policy configuration.
     *
     * @param initialMs delay before the first retry, before jitter
     * @param maxMs     cap applied before jitter
     * @param factor    multiplicative factor per attempt
     * @param jitter    fraction of the capped delay that may be shaved off
     *                  (0..1); 0.5 yields delays in {@code [0.5x, 1.0x]}
     */
    public record Policy(long initialMs, long maxMs, double factor, double jitter) {

        /** Presence and channel links: 500ms initial, 15s cap. */
        public static final Policy FAST = new Policy(500, 15_000, 2.0, 0.5);

        /** Main data link: 1s initial, 30s cap. */
        public static final Policy STANDARD = new Policy(1_000, 30_000, 2.0, 0.5);

        public Policy {
            if (initialMs <= 0) {
                throw new IllegalArgumentException("initialMs must be positive: " + initialMs);
            }
            if (maxMs < initialMs) {
                throw new IllegalArgumentException("maxMs must be >= initialMs: " + maxMs);
            }
            if (factor < 1.0) {
                throw new IllegalArgumentException("factor must be >= 1: " + factor);
            }
            if (jitter < 0.0 || jitter > 1.0) {
                throw new IllegalArgumentException("jitter must be within [0, 1]: " + jitter);
            }
        }

        /**
         * Policy with the standard factor and jitter and the given bounds.
         */
        public static Policy of(long initialMs, long maxMs) {
            return new Policy(initialMs, maxMs, 2.0, 0.5);
        }
    }

    /**
     * Un-jittered delay for an attempt: {@code min(initial * factor^attempt, max)}.
     *
     * @param policy  backoff policy
     * @param attempt 0-based attempt number
     */
    public static long ceiling(Policy policy, int attempt) {
        double base = policy.initialMs() * Math.pow(policy.factor(), Math.max(attempt, 0));
        return (long) Math.min(policy.maxMs(), base);
    }

    /**
     * Compute the jittered delay for an attempt.
     *
     * @param policy  backoff policy
     * @param attempt 0-based attempt number
     * @param sample  uniform sample in {@code [0, 1]}; 0 gives the ceiling
     * @return delay in milliseconds within
     *         {@code [(1 - jitter) * ceiling, ceiling]}
     */
    public static long compute(Policy policy, int attempt, double sample) {
        long ceiling = ceiling(policy, attempt);
        double clamped = Math.min(1.0, Math.max(0.0, sample));
        long floor = (long) Math.ceil(ceiling * (1.0 - policy.jitter()));
        return Math.max(floor, Math.round(ceiling * (1.0 - policy.jitter() * clamped)));
    }

    /**
     * Compute the jittered delay using a thread-local random sample.
     */
    public static long compute(Policy policy, int attempt) {
        return compute(policy, attempt, ThreadLocalRandom.current().nextDouble());
    }
}
