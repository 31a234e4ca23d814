package com.agentwatch.common.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigServiceTest {

    @TempDir
    Path tempDir;
    private Path configPath;

    @BeforeEach
    void setUp() {
        configPath = tempDir.resolve("agentwatch.json");
    }

    @Test
    void loadConfig_validJson_returnsConfig() throws IOException {
        String json = """
                {
                  "monitor": { "tailBytes": 1024, "staleAfterMs": 60000 },
                  "providers": {
                    "claude": { "pollIntervalMs": 5000 },
                    "codex": { "enabled": false }
                  },
                  "registry": { "ttlMs": 1000, "persist": false }
                }
                """;
        Files.writeString(configPath, json);

        WatchConfig config = new ConfigService(configPath).loadConfig();

        assertEquals(1024, config.getMonitor().getTailBytes());
        assertEquals(60_000, config.getMonitor().getStaleAfterMs());
        assertEquals(300_000, config.getMonitor().getActiveWindowMs());
        assertEquals(5000L, config.providerOrDefault("claude").getPollIntervalMs());
        assertFalse(config.providerOrDefault("codex").isEnabled());
        assertEquals(1000, config.getRegistry().getTtlMs());
        assertFalse(config.getRegistry().isPersist());
    }

    @Test
    void loadConfig_missingFile_returnsDefaults() {
        WatchConfig config = new ConfigService(tempDir.resolve("nonexistent.json")).loadConfig();

        assertNotNull(config.getMonitor());
        assertEquals(256_000, config.getMonitor().getTailBytes());
        assertEquals(86_400_000L, config.getRegistry().getTtlMs());
        assertEquals("codex", config.getRegistry().getDefaultProvider());
        assertEquals(15.0, config.providerOrDefault("claude").getPricing().getInputPerMTok());
        assertEquals(8.0, config.providerOrDefault("codex").getPricing().getOutputPerMTok());
    }

    @Test
    void loadConfig_malformedFile_returnsDefaults() throws IOException {
        Files.writeString(configPath, "{ not json");

        WatchConfig config = new ConfigService(configPath).loadConfig();

        assertEquals(256_000, config.getMonitor().getTailBytes());
    }

    @Test
    void loadConfig_explicitPricingIsKept() throws IOException {
        Files.writeString(configPath, """
                { "providers": { "claude": { "pricing": { "inputPerMTok": 3, "outputPerMTok": 15, "cachedPerMTok": 0.3 } } } }
                """);

        WatchConfig config = new ConfigService(configPath).loadConfig();

        assertEquals(3.0, config.providerOrDefault("claude").getPricing().getInputPerMTok());
    }

    @Test
    void substituteEnvVars_plainString_noChange() {
        ConfigService service = new ConfigService(configPath);
        assertEquals("hello", service.substituteEnvVars("hello"));
    }

    @Test
    void substituteEnvVars_withDefault_usesDefault() {
        ConfigService service = new ConfigService(configPath, Duration.ofMillis(200), Map.of());
        assertEquals("fallback", service.substituteEnvVars("${AGENTWATCH_UNSET:-fallback}"));
    }

    @Test
    void substituteEnvVars_setVariable_isReplaced() throws IOException {
        Files.writeString(configPath, """
                { "registry": { "storePath": "${STORE_DIR}/sessions.json" } }
                """);
        ConfigService service = new ConfigService(configPath, Duration.ofMillis(200),
                Map.of("STORE_DIR", "/var/lib/agentwatch"));

        assertEquals("/var/lib/agentwatch/sessions.json",
                service.loadConfig().getRegistry().getStorePath());
    }

    @Test
    void loadConfig_isCached() throws IOException {
        Files.writeString(configPath, "{ \"monitor\": { \"tailBytes\": 10 } }");

        ConfigService service = new ConfigService(configPath, Duration.ofMinutes(1), Map.of());
        WatchConfig first = service.loadConfig();
        WatchConfig second = service.loadConfig();
        assertSame(first, second);

        Files.writeString(configPath, "{ \"monitor\": { \"tailBytes\": 20 } }");
        assertEquals(10, service.loadConfig().getMonitor().getTailBytes());
        assertEquals(20, service.reloadConfig().getMonitor().getTailBytes());
    }
}
