package com.agentwatch.registry;

import java.util.List;

/**
 * On-disk document of the registry.
 */
public record RegistryPayload(int version, List<SessionRegistryRecord> sessions) {

    public static final int CURRENT_VERSION = 1;
}
