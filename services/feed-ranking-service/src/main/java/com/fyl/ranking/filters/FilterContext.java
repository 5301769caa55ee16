package com.fyl.ranking.filters;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

/**
 * Per-request inputs shared by the pre-scoring filters. {@code now} is fixed for the whole pass so
 * the chain stays idempotent.
 */
public record FilterContext(String viewerId, Instant now, Duration maxAge, Set<String> seenPostIds) {
    public FilterContext {
        seenPostIds = seenPostIds == null ? Set.of() : Set.copyOf(seenPostIds);
    }
}
