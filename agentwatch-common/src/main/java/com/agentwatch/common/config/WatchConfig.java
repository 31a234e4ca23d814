package com.agentwatch.common.config;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root configuration type for agentwatch.
 * Loaded from {@code agentwatch.json} by {@link ConfigService}.
 */
@Data
public class WatchConfig {

    /** Transcript tailing and lifecycle thresholds shared by every provider. */
    private MonitorConfig monitor;

    /** Per-provider settings keyed by provider name (e.g. "claude", "codex"). */
    private Map<String, ProviderConfig> providers;

    /** Resumable session registry settings. */
    private RegistryConfig registry;

    // --- Nested config types ---

    @Data
    public static class MonitorConfig {
        /** Trailing byte window read from each transcript. */
        private int tailBytes = 256_000;
        /** A session with a live process is active while its transcript changed within this window. */
        private long activeWindowMs = 5 * 60 * 1000L;
        /** Sessions without a live process older than this are dropped. */
        private long staleAfterMs = 24 * 60 * 60 * 1000L;
        private long pollIntervalMs = 30_000L;
    }

    @Data
    public static class ProviderConfig {
        private boolean enabled = true;
        /** Overrides {@link MonitorConfig#getPollIntervalMs()} when set. */
        private Long pollIntervalMs;
        private PricingConfig pricing;
    }

    @Data
    public static class PricingConfig {
        /** USD per million uncached input tokens. */
        private double inputPerMTok;
        /** USD per million output tokens. */
        private double outputPerMTok;
        /** USD per million cache-read tokens. */
        private double cachedPerMTok;
    }

    @Data
    public static class RegistryConfig {
        private long ttlMs = 24 * 60 * 60 * 1000L;
        private boolean persist = true;
        /** Persisted registry file. Defaults to {@code <stateDir>/resume-sessions.json}. */
        private String storePath;
        private String defaultProvider = "codex";
    }

    /**
     * Resolve the provider config, falling back to an enabled provider with no
     * overrides.
     */
    public ProviderConfig providerOrDefault(String name) {
        if (providers == null) {
            return new ProviderConfig();
        }
        ProviderConfig config = providers.get(name);
        return config != null ? config : new ProviderConfig();
    }

    /**
     * Register a provider entry, creating the provider map if needed.
     */
    public void putProvider(String name, ProviderConfig config) {
        if (providers == null) {
            providers = new LinkedHashMap<>();
        }
        providers.put(name, config);
    }
}
