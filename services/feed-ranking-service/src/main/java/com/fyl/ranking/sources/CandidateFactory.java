package com.fyl.ranking.sources;

import com.fyl.ranking.candidate.Candidate;
import com.fyl.ranking.candidate.CandidateFeatures;
import com.fyl.ranking.candidate.CandidateSource;
import com.fyl.ranking.model.Post;
import com.fyl.ranking.model.User;
import com.fyl.ranking.store.ReadStore;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Turns store post ids into candidates: batch-resolves posts and authors, reads live engagement
 * counts. Ids the store cannot resolve are dropped; unresolved authors stay {@code null}.
 */
@Component
public class CandidateFactory {
    private final ReadStore store;

    public CandidateFactory(ReadStore store) {
        this.store = store;
    }

    public List<Candidate> build(List<String> postIds, CandidateSource source, String provider) {
        if (postIds == null || postIds.isEmpty()) {
            return new ArrayList<>();
        }
        Map<String, Post> posts = store.getPosts(postIds);
        Set<String> authorIds = new LinkedHashSet<>();
        for (Post post : posts.values()) {
            authorIds.add(post.authorId());
        }
        Map<String, User> authors = store.getUsers(authorIds);
        CandidateFeatures features = CandidateFeatures.of(provider);

        List<Candidate> out = new ArrayList<>(posts.size());
        for (Post post : posts.values()) {
            out.add(
                new Candidate(
                    post,
                    authors.get(post.authorId()),
                    source,
                    store.getEngagementCounts(post.id()),
                    features
                )
            );
        }
        return out;
    }
}
