package com.agentwatch.monitor.session;

/**
 * Summed token counters and estimated cost across a set of sessions.
 */
public record TokenTotals(long input, long output, long cached, double estimatedCostUsd) {

    public static final TokenTotals ZERO = new TokenTotals(0, 0, 0, 0);

    public TokenTotals plus(TokenTotals other) {
        return new TokenTotals(input + other.input, output + other.output,
                cached + other.cached, estimatedCostUsd + other.estimatedCostUsd);
    }

    public TokenTotals plus(TokenCounts tokens, double costUsd) {
        return new TokenTotals(input + tokens.input(), output + tokens.output(),
                cached + tokens.cached(), estimatedCostUsd + costUsd);
    }
}
