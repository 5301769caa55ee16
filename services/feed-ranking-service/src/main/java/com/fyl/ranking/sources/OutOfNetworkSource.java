package com.fyl.ranking.sources;

import com.fyl.ranking.candidate.Candidate;
import com.fyl.ranking.candidate.CandidateFeatures;
import com.fyl.ranking.candidate.CandidateSource;
import com.fyl.ranking.model.Post;
import com.fyl.ranking.model.User;
import com.fyl.ranking.store.ReadStore;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Globally recent original posts by authors the viewer does not follow.
 */
@Component
public class OutOfNetworkSource {
    private final ReadStore store;
    private final CandidateFactory candidateFactory;

    public OutOfNetworkSource(ReadStore store, CandidateFactory candidateFactory) {
        this.store = store;
        this.candidateFactory = candidateFactory;
    }

    public List<Candidate> fetch(String viewerId, int limitOutOfNetwork) {
        if (limitOutOfNetwork <= 0) {
            return new ArrayList<>();
        }
        Set<String> following = new HashSet<>(store.getUser(viewerId).map(User::followingIds).orElse(List.of()));
        List<String> pool = store.getGlobalRecent(limitOutOfNetwork * 2, null);
        Map<String, Post> posts = store.getPosts(pool);

        List<String> oonIds = new ArrayList<>();
        for (String postId : pool) {
            Post post = posts.get(postId);
            if (post == null || following.contains(post.authorId())) {
                continue;
            }
            oonIds.add(postId);
            if (oonIds.size() >= limitOutOfNetwork) {
                break;
            }
        }
        return candidateFactory.build(oonIds, CandidateSource.OUT_OF_NETWORK, CandidateFeatures.PROVIDER_GLOBAL_RECENT);
    }
}
