package com.fyl.ranking.feed;

import com.fyl.ranking.api.dto.AlgorithmPreferences;
import com.fyl.ranking.api.dto.FeedResponse;
import com.fyl.ranking.mixer.FeedQuery;
import com.fyl.ranking.mixer.HomeMixer;
import com.fyl.ranking.mixer.MixerProperties;
import com.fyl.ranking.store.ReadStore;
import java.util.Set;
import org.springframework.stereotype.Service;

/**
 * Caller-side entry point: enforces that the viewer exists and resolves preferences
 * (request &gt; stored per-user &gt; defaults) before handing off to the {@link HomeMixer}.
 */
@Service
public class FeedService {
    private final HomeMixer homeMixer;
    private final ReadStore store;
    private final PreferencesRepository preferencesRepository;
    private final MixerProperties mixerProperties;

    public FeedService(
        HomeMixer homeMixer,
        ReadStore store,
        PreferencesRepository preferencesRepository,
        MixerProperties mixerProperties
    ) {
        this.homeMixer = homeMixer;
        this.store = store;
        this.preferencesRepository = preferencesRepository;
        this.mixerProperties = mixerProperties;
    }

    public FeedResponse getFeed(
        String userId,
        AlgorithmPreferences preferences,
        Integer limit,
        Set<String> seenPostIds,
        boolean includeExplanations,
        boolean followingOnly
    ) {
        requireUser(userId);
        int resolvedLimit = limit == null ? mixerProperties.getDefaultLimit() : limit;
        FeedQuery query = new FeedQuery(userId, preferences, resolvedLimit, seenPostIds, includeExplanations, followingOnly);
        return homeMixer.getFeed(query.withPreferences(resolvePreferences(userId, preferences)));
    }

    /**
     * Full explanations with the user's stored (or default) preferences.
     */
    public FeedResponse explainFeed(String userId, int limit) {
        return getFeed(userId, null, limit, null, true, false);
    }

    public AlgorithmPreferences getPreferences(String userId) {
        requireUser(userId);
        return preferencesRepository.find(userId).orElseGet(AlgorithmPreferences::defaults);
    }

    public AlgorithmPreferences updatePreferences(String userId, AlgorithmPreferences preferences) {
        requireUser(userId);
        AlgorithmPreferences resolved = preferences == null ? AlgorithmPreferences.defaults() : preferences;
        preferencesRepository.save(userId, resolved);
        return resolved.copy();
    }

    private AlgorithmPreferences resolvePreferences(String userId, AlgorithmPreferences requested) {
        if (requested != null) {
            return requested;
        }
        return preferencesRepository.find(userId).orElseGet(AlgorithmPreferences::defaults);
    }

    private void requireUser(String userId) {
        if (store.getUser(userId).isEmpty()) {
            throw new UnknownUserException(userId);
        }
    }
}
