package com.agentwatch.monitor.session;

/**
 * USD prices per million tokens for one provider.
 */
public record TokenPricing(double inputPerMTok, double outputPerMTok, double cachedPerMTok) {

    public static final TokenPricing FREE = new TokenPricing(0, 0, 0);

    private static final double PER_MILLION = 1_000_000d;

    /**
     * Cached tokens are billed at the cached rate and removed from the input
     * term. The input term never goes negative.
     */
    public double estimateCost(TokenCounts tokens) {
        long uncachedInput = Math.max(0, tokens.input() - tokens.cached());
        return uncachedInput * inputPerMTok / PER_MILLION
                + tokens.output() * outputPerMTok / PER_MILLION
                + tokens.cached() * cachedPerMTok / PER_MILLION;
    }
}
