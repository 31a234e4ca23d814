package com.agentwatch.monitor.provider;

import com.agentwatch.common.config.WatchConfig;

/**
 * Tailing and lifecycle thresholds for a {@link ProviderSessionMonitor}.
 */
public record MonitorSettings(int tailBytes, long activeWindowMs, long staleAfterMs) {

    public static final MonitorSettings DEFAULTS = from(new WatchConfig.MonitorConfig());

    public static MonitorSettings from(WatchConfig.MonitorConfig config) {
        return new MonitorSettings(config.getTailBytes(), config.getActiveWindowMs(),
                config.getStaleAfterMs());
    }
}
