package com.agentwatch.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches agentwatch configuration.
 */
@Slf4j
public class ConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, WatchConfig> cache;
    private final Path configPath;
    private final Map<String, String> env;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System.getenv());
    }

    public ConfigService(Path configPath, Duration cacheTtl, Map<String, String> env) {
        // Expand ~ to user home directory
        String pathStr = configPath.toString();
        if (pathStr.startsWith("~")) {
            configPath = ConfigPaths.resolveUserPath(pathStr, System.getProperty("user.home"));
        }
        this.configPath = configPath;
        this.env = env;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config with caching.
     */
    public WatchConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public WatchConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    /**
     * Get the config file path.
     */
    public Path getConfigPath() {
        return configPath;
    }

    private WatchConfig doLoadConfig() {
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults", configPath);
            return applyDefaults(new WatchConfig());
        }
        try {
            String raw = Files.readString(configPath);

            // Environment variable substitution
            raw = substituteEnvVars(raw);

            WatchConfig config = objectMapper.readValue(raw, WatchConfig.class);
            if (config == null) {
                config = new WatchConfig();
            }
            log.info("Config loaded from: {}", configPath);
            return applyDefaults(config);
        } catch (IOException e) {
            log.error("Failed to load config from: {}", configPath, e);
            return applyDefaults(new WatchConfig());
        }
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = env.getOrDefault(varName,
                    defaultValue != null ? defaultValue : "");
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Apply default values to missing config sections. The built-in providers
     * always get their reference pricing unless the file sets its own.
     */
    WatchConfig applyDefaults(WatchConfig config) {
        if (config.getMonitor() == null) {
            config.setMonitor(new WatchConfig.MonitorConfig());
        }
        if (config.getRegistry() == null) {
            config.setRegistry(new WatchConfig.RegistryConfig());
        }
        if (config.getProviders() == null) {
            config.setProviders(new LinkedHashMap<>());
        }
        for (var entry : defaultPricing().entrySet()) {
            WatchConfig.ProviderConfig provider = config.getProviders()
                    .computeIfAbsent(entry.getKey(), k -> new WatchConfig.ProviderConfig());
            if (provider.getPricing() == null) {
                provider.setPricing(entry.getValue());
            }
        }
        return config;
    }

    private static Map<String, WatchConfig.PricingConfig> defaultPricing() {
        Map<String, WatchConfig.PricingConfig> pricing = new LinkedHashMap<>();
        pricing.put("claude", pricing(15, 75, 1.5));
        pricing.put("codex", pricing(2, 8, 0.5));
        return pricing;
    }

    private static WatchConfig.PricingConfig pricing(double input, double output, double cached) {
        WatchConfig.PricingConfig config = new WatchConfig.PricingConfig();
        config.setInputPerMTok(input);
        config.setOutputPerMTok(output);
        config.setCachedPerMTok(cached);
        return config;
    }
}
