package com.fyl.ranking.sources;

import com.fyl.ranking.candidate.Candidate;
import com.fyl.ranking.candidate.CandidateFeatures;
import com.fyl.ranking.candidate.CandidateSource;
import com.fyl.ranking.model.User;
import com.fyl.ranking.store.ReadStore;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Recent posts from accounts the viewer follows.
 */
@Component
public class InNetworkSource {
    private final ReadStore store;
    private final CandidateFactory candidateFactory;

    public InNetworkSource(ReadStore store, CandidateFactory candidateFactory) {
        this.store = store;
        this.candidateFactory = candidateFactory;
    }

    public List<Candidate> fetch(String viewerId, int limitPerAuthor, int limitInNetwork) {
        Optional<User> viewer = store.getUser(viewerId);
        if (viewer.isEmpty() || viewer.get().followingIds().isEmpty() || limitInNetwork <= 0) {
            return new ArrayList<>();
        }
        List<String> postIds = store.getRecentPostIdsForFollowing(viewer.get().followingIds(), limitPerAuthor, null);
        if (postIds.size() > limitInNetwork) {
            postIds = postIds.subList(0, limitInNetwork);
        }
        return candidateFactory.build(postIds, CandidateSource.IN_NETWORK, CandidateFeatures.PROVIDER_FOLLOWING);
    }
}
