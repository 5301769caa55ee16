package com.fyl.ranking.feed;

import com.fyl.ranking.api.dto.AlgorithmPreferences;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

@Component
public class InMemoryPreferencesRepository implements PreferencesRepository {
    private final ConcurrentHashMap<String, AlgorithmPreferences> preferencesByUser = new ConcurrentHashMap<>();

    @Override
    public Optional<AlgorithmPreferences> find(String userId) {
        if (userId == null) {
            return Optional.empty();
        }
        AlgorithmPreferences stored = preferencesByUser.get(userId);
        return stored == null ? Optional.empty() : Optional.of(stored.copy());
    }

    @Override
    public void save(String userId, AlgorithmPreferences preferences) {
        if (userId == null || preferences == null) {
            return;
        }
        preferencesByUser.put(userId, preferences.copy());
    }
}
