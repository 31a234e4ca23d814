package com.agentwatch.registry;

import lombok.Builder;

/**
 * Filter for {@link SessionRegistry#list}. Null fields do not filter.
 */
@Builder
public record ListFilter(String ownerUserId, String mappingKey, boolean includeArchived, Long now) {

    public static final ListFilter ALL = new ListFilter(null, null, false, null);
}
