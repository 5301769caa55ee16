package com.fyl.ranking.trends;

import com.fyl.ranking.model.TopicCount;
import com.fyl.ranking.store.ReadStore;
import java.util.List;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

/**
 * Topic volume over a trailing window. Not part of the ranking path.
 */
@Service
@EnableConfigurationProperties(TrendsProperties.class)
public class TrendingTopicsService {
    private final ReadStore store;
    private final TrendsProperties properties;

    public TrendingTopicsService(ReadStore store, TrendsProperties properties) {
        this.store = store;
        this.properties = properties;
    }

    public List<TopicCount> trending() {
        return trending(properties.getLimit());
    }

    public List<TopicCount> trending(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return store.getTopicCounts(properties.getWindow(), limit);
    }
}
