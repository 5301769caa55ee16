package com.fyl.ranking.filters;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.fyl.ranking.candidate.Candidate;
import com.fyl.ranking.candidate.CandidateSource;
import com.fyl.ranking.model.Post;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class PreScoringFilterChainTest {
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final Duration MAX_AGE = Duration.ofHours(168);

    private final PreScoringFilterChain chain = PreScoringFilterChain.standard();

    @Test
    void runsFiltersInDeclaredOrder() {
        assertEquals(List.of("drop_duplicates", "max_age", "self_post", "previously_seen"), chain.filterNames());
    }

    @Test
    void dropsDuplicatesKeepingFirstOccurrence() {
        Candidate first = candidate("p1", "u2", NOW, CandidateSource.IN_NETWORK);
        Candidate again = candidate("p1", "u2", NOW, CandidateSource.OUT_OF_NETWORK);

        List<Candidate> out = chain.apply(List.of(first, again), context(Set.of()));

        assertEquals(1, out.size());
        assertEquals(CandidateSource.IN_NETWORK, out.get(0).getSource());
    }

    @Test
    void agesOutOldPostsButKeepsTheCutoffItself() {
        List<Candidate> candidates = List.of(
            candidate("fresh", "u2", NOW.minus(Duration.ofHours(1)), CandidateSource.IN_NETWORK),
            candidate("edge", "u2", NOW.minus(MAX_AGE), CandidateSource.IN_NETWORK),
            candidate("stale", "u2", NOW.minus(MAX_AGE).minusSeconds(1), CandidateSource.IN_NETWORK)
        );

        assertThat(ids(chain.apply(candidates, context(Set.of())))).containsExactly("fresh", "edge");
    }

    @Test
    void dropsViewerOwnPostsAndSeenPosts() {
        List<Candidate> candidates = List.of(
            candidate("mine", "viewer", NOW, CandidateSource.IN_NETWORK),
            candidate("seen", "u2", NOW, CandidateSource.IN_NETWORK),
            candidate("new", "u3", NOW, CandidateSource.OUT_OF_NETWORK)
        );

        assertThat(ids(chain.apply(candidates, context(Set.of("seen"))))).containsExactly("new");
    }

    @Test
    void preservesSurvivorOrderAndIsIdempotent() {
        List<Candidate> candidates = List.of(
            candidate("p3", "u3", NOW, CandidateSource.OUT_OF_NETWORK),
            candidate("p1", "u2", NOW, CandidateSource.IN_NETWORK),
            candidate("p1", "u2", NOW, CandidateSource.IN_NETWORK),
            candidate("p2", "viewer", NOW, CandidateSource.IN_NETWORK),
            candidate("p4", "u4", NOW.minus(Duration.ofDays(30)), CandidateSource.OUT_OF_NETWORK),
            candidate("p5", "u4", NOW, CandidateSource.OUT_OF_NETWORK)
        );
        FilterContext context = context(Set.of("p5"));

        List<Candidate> once = chain.apply(candidates, context);
        List<Candidate> twice = chain.apply(once, context);

        assertThat(ids(once)).containsExactly("p3", "p1");
        assertEquals(ids(once), ids(twice));
    }

    @Test
    void neverMutatesInput() {
        List<Candidate> candidates = new ArrayList<>(List.of(
            candidate("p1", "viewer", NOW, CandidateSource.IN_NETWORK),
            candidate("p2", "u2", NOW, CandidateSource.IN_NETWORK)
        ));

        chain.apply(candidates, context(Set.of()));

        assertEquals(2, candidates.size());
    }

    private static FilterContext context(Set<String> seen) {
        return new FilterContext("viewer", NOW, MAX_AGE, seen);
    }

    private static Candidate candidate(String postId, String authorId, Instant createdAt, CandidateSource source) {
        Post post = Post.original(postId, authorId, "text " + postId, List.of(), createdAt);
        return new Candidate(post, null, source, Map.of(), null);
    }

    private static List<String> ids(List<Candidate> candidates) {
        List<String> ids = new ArrayList<>();
        for (Candidate candidate : candidates) {
            ids.add(candidate.getPostId());
        }
        return ids;
    }
}
