package com.agentwatch.registry;

import lombok.Builder;

/**
 * Input to {@link SessionRegistry#upsert}. A null {@code provider} falls back
 * to the registry default and a null {@code timestamp} to the current time.
 */
@Builder
public record SessionRegistryUpsert(
        String sessionId,
        String provider,
        String ownerUserId,
        String mappingKey,
        String cwd,
        String threadChannelId,
        String parentChannelId,
        Long timestamp) {
}
