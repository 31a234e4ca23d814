package com.agentwatch.monitor.provider;

import java.nio.file.Path;

/**
 * A session announced by a hook before discovery has seen it.
 */
public record SessionRegistration(String sessionId, String cwd, Path transcriptPath, String model) {
}
