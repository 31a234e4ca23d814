package com.agentwatch.app;

/**
 * Chat thread a started session was attached to.
 *
 * @param mappingKey logical grouping of the thread, e.g. a workspace channel
 */
public record ThreadBinding(String ownerUserId, String mappingKey, String threadChannelId,
        String parentChannelId) {
}
