package com.agentwatch.monitor.session;

/**
 * Cumulative token counters for one session.
 */
public record TokenCounts(long input, long output, long cached) {

    public static final TokenCounts ZERO = new TokenCounts(0, 0, 0);

    public TokenCounts plus(TokenCounts other) {
        return new TokenCounts(input + other.input, output + other.output, cached + other.cached);
    }
}
