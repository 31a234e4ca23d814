package com.agentwatch.registry;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

/**
 * A resumable session tracked by {@link SessionRegistry}. Timestamps are
 * epoch milliseconds.
 *
 * @param mappingKey logical grouping the session belongs to, e.g. a workspace
 * @param archivedAt set once the session was closed explicitly
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionRegistryRecord(
        String sessionId,
        String provider,
        String ownerUserId,
        String mappingKey,
        String cwd,
        String threadChannelId,
        String parentChannelId,
        long createdAt,
        long lastUsedAt,
        Long archivedAt) {

    @JsonIgnore
    public boolean isArchived() {
        return archivedAt != null;
    }
}
