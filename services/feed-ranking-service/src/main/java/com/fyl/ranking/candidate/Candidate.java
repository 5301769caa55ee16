package com.fyl.ranking.candidate;

import com.fyl.ranking.model.EngagementType;
import com.fyl.ranking.model.Post;
import com.fyl.ranking.model.User;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * A post enriched for one ranking pass. Never cached across requests.
 */
public class Candidate {
    private final Post post;
    private final User author;
    private final CandidateSource source;
    private final Map<EngagementType, Integer> engagementCounts;
    private final CandidateFeatures features;

    public Candidate(
        Post post,
        User author,
        CandidateSource source,
        Map<EngagementType, Integer> engagementCounts,
        CandidateFeatures features
    ) {
        this.post = post;
        this.author = author;
        this.source = source;
        Map<EngagementType, Integer> counts = new EnumMap<>(EngagementType.class);
        if (engagementCounts != null) {
            counts.putAll(engagementCounts);
        }
        this.engagementCounts = Collections.unmodifiableMap(counts);
        this.features = features == null ? CandidateFeatures.of(null) : features;
    }

    public Post getPost() {
        return post;
    }

    public String getPostId() {
        return post.id();
    }

    public String getAuthorId() {
        return post.authorId();
    }

    /**
     * May be {@code null} when the author record could not be resolved.
     */
    public User getAuthor() {
        return author;
    }

    public CandidateSource getSource() {
        return source;
    }

    public Map<EngagementType, Integer> getEngagementCounts() {
        return engagementCounts;
    }

    public int engagementCount(EngagementType type) {
        Integer count = engagementCounts.get(type);
        return count == null ? 0 : count;
    }

    public CandidateFeatures getFeatures() {
        return features;
    }
}
