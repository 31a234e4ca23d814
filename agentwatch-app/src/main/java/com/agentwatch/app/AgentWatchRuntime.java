package com.agentwatch.app;

import com.agentwatch.common.config.ConfigPaths;
import com.agentwatch.common.config.ConfigService;
import com.agentwatch.common.config.WatchConfig;
import com.agentwatch.common.infra.PollRunner;
import com.agentwatch.hooks.HookEventDispatcher;
import com.agentwatch.monitor.aggregate.SessionAggregator;
import com.agentwatch.monitor.provider.MonitorSettings;
import com.agentwatch.monitor.provider.ProviderSessionMonitor;
import com.agentwatch.monitor.provider.SessionDiscovery;
import com.agentwatch.monitor.session.TokenPricing;
import com.agentwatch.monitor.transcript.TranscriptTailer;
import com.agentwatch.registry.SessionRegistry;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wires the session pipeline from configuration: one monitor and poller per
 * enabled provider, the aggregator over them, the resume registry and the
 * hook dispatcher.
 * <p>
 * Discovery is supplied by the caller per provider name; providers without a
 * discovery are not monitored.
 */
@Slf4j
public class AgentWatchRuntime implements AutoCloseable {

    private final WatchConfig config;
    private final Map<String, ProviderSessionMonitor> monitors = new LinkedHashMap<>();
    private final Map<String, PollRunner> pollers = new LinkedHashMap<>();
    private final SessionAggregator aggregator = new SessionAggregator();
    private final SessionRegistry registry;
    private final HookEventDispatcher dispatcher;
    private boolean started;

    public static AgentWatchRuntime fromConfig(ConfigService configService,
            Map<String, SessionDiscovery> discoveries) {
        WatchConfig config = configService.loadConfig();
        WatchConfig.RegistryConfig registryConfig = config.getRegistry();
        Path storePath = registryConfig.isPersist()
                ? ConfigPaths.resolveRegistryStorePath(registryConfig.getStorePath())
                : null;
        return new AgentWatchRuntime(config, discoveries, storePath);
    }

    /**
     * @param config            configuration with defaults applied
     * @param registryStorePath registry file, or null to keep the registry in memory
     */
    public AgentWatchRuntime(WatchConfig config, Map<String, SessionDiscovery> discoveries,
            Path registryStorePath) {
        this.config = config;
        MonitorSettings settings = MonitorSettings.from(config.getMonitor());

        for (Map.Entry<String, SessionDiscovery> entry : discoveries.entrySet()) {
            String name = entry.getKey();
            WatchConfig.ProviderConfig providerConfig = config.providerOrDefault(name);
            if (!providerConfig.isEnabled()) {
                log.info("Provider {} disabled", name);
                continue;
            }
            ProviderSessionMonitor monitor = new ProviderSessionMonitor(name, entry.getValue(),
                    settings, toPricing(providerConfig.getPricing()));
            monitors.put(name, monitor);
            aggregator.register(monitor);

            long interval = providerConfig.getPollIntervalMs() != null
                    ? providerConfig.getPollIntervalMs()
                    : config.getMonitor().getPollIntervalMs();
            pollers.put(name, new PollRunner(name, interval, monitor::refresh));
        }

        WatchConfig.RegistryConfig registryConfig = config.getRegistry();
        this.registry = new SessionRegistry(registryConfig.getTtlMs(), registryStorePath,
                registryConfig.getDefaultProvider());
        this.dispatcher = new HookEventDispatcher(monitors,
                new TranscriptTailer(config.getMonitor().getTailBytes()));
    }

    /**
     * Load the registry, refresh every monitor once and start polling.
     */
    public synchronized void start() {
        if (started) {
            return;
        }
        started = true;
        registry.load();
        for (ProviderSessionMonitor monitor : monitors.values()) {
            monitor.refresh();
        }
        pollers.values().forEach(PollRunner::start);
        log.info("AgentWatch started with providers {}", monitors.keySet());
    }

    /**
     * Bind newly started sessions to chat threads and record them in the
     * registry.
     */
    public void bindThreads(ThreadBinder binder) {
        dispatcher.addSessionStartListener(new RegistryBindingListener(registry, binder));
    }

    public SessionAggregator getAggregator() {
        return aggregator;
    }

    public SessionRegistry getRegistry() {
        return registry;
    }

    public HookEventDispatcher getDispatcher() {
        return dispatcher;
    }

    public Map<String, ProviderSessionMonitor> getMonitors() {
        return Collections.unmodifiableMap(monitors);
    }

    public Map<String, PollRunner> getPollers() {
        return Collections.unmodifiableMap(pollers);
    }

    public WatchConfig getConfig() {
        return config;
    }

    @Override
    public synchronized void close() {
        pollers.values().forEach(PollRunner::close);
        registry.close();
        log.info("AgentWatch stopped");
    }

    static TokenPricing toPricing(WatchConfig.PricingConfig pricing) {
        if (pricing == null) {
            return TokenPricing.FREE;
        }
        return new TokenPricing(pricing.getInputPerMTok(), pricing.getOutputPerMTok(),
                pricing.getCachedPerMTok());
    }
}
