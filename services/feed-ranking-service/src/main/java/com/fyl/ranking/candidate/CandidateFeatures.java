package com.fyl.ranking.candidate;

import java.util.Map;

/**
 * Signals attached to a candidate at sourcing time.
 *
 * @param provider which pool produced the candidate, e.g. {@code following}, {@code global_recent}
 *     or an external provider id
 * @param extensions speculative signals; keys and value types are unstable and must not be relied
 *     on by scoring
 */
public record CandidateFeatures(String provider, Map<String, Object> extensions) {
    public static final String PROVIDER_FOLLOWING = "following";
    public static final String PROVIDER_GLOBAL_RECENT = "global_recent";

    public CandidateFeatures {
        extensions = extensions == null ? Map.of() : Map.copyOf(extensions);
    }

    public static CandidateFeatures of(String provider) {
        return new CandidateFeatures(provider, Map.of());
    }
}
