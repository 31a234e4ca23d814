package com.agentwatch.registry;

import lombok.Builder;

/**
 * Input to {@link SessionRegistry#resolveResumeTarget}.
 *
 * @param explicitSessionId session the caller asked for by id, if any
 * @param threadChannelId   chat thread the request came from, if any
 * @param now               evaluation time; null means the registry clock
 */
@Builder
public record ResumeRequest(
        String explicitSessionId,
        String threadChannelId,
        String ownerUserId,
        String mappingKey,
        Long now) {
}
