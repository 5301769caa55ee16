package com.fyl.ranking.feed;

import com.fyl.ranking.api.dto.AlgorithmPreferences;
import java.util.Optional;

/**
 * Per-user preference overrides. Passed explicitly to the feed façade so ranking itself stays
 * free of per-user state.
 */
public interface PreferencesRepository {
    Optional<AlgorithmPreferences> find(String userId);

    void save(String userId, AlgorithmPreferences preferences);
}
