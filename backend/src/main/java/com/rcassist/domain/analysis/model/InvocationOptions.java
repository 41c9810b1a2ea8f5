package com.rcassist.domain.analysis.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-call limits for one gateway invocation.
 *
 * @param timeout     upper bound for a single provider attempt
 * @param maxTokens   completion token budget
 * @param temperature sampling temperature
 */
public record InvocationOptions(Duration timeout, int maxTokens, double temperature) {

    public InvocationOptions {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout must be positive: " + timeout);
        }
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive: " + maxTokens);
        }
    }
}
