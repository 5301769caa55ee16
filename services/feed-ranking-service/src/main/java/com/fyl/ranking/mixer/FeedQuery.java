package com.fyl.ranking.mixer;

import com.fyl.ranking.api.dto.AlgorithmPreferences;
import java.util.Set;

/**
 * One ranking request. {@code preferences} and {@code seenPostIds} may be {@code null}.
 * {@code includeExplanations} only affects the payload, never scoring or order.
 */
public record FeedQuery(
    String userId,
    AlgorithmPreferences preferences,
    int limit,
    Set<String> seenPostIds,
    boolean includeExplanations,
    boolean followingOnly
) {
    public FeedQuery withPreferences(AlgorithmPreferences resolved) {
        return new FeedQuery(userId, resolved, limit, seenPostIds, includeExplanations, followingOnly);
    }
}
