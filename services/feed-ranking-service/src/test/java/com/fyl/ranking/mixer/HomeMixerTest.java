package com.fyl.ranking.mixer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fyl.ranking.api.dto.AlgorithmPreferences;
import com.fyl.ranking.api.dto.FeedItem;
import com.fyl.ranking.api.dto.FeedResponse;
import com.fyl.ranking.api.dto.RankingExplanation;
import com.fyl.ranking.candidate.Candidate;
import com.fyl.ranking.candidate.CandidateFeatures;
import com.fyl.ranking.candidate.CandidateSource;
import com.fyl.ranking.external.ExternalContentSource;
import com.fyl.ranking.filters.PreScoringFilterChain;
import com.fyl.ranking.model.Engagement;
import com.fyl.ranking.model.EngagementType;
import com.fyl.ranking.model.Post;
import com.fyl.ranking.model.User;
import com.fyl.ranking.scoring.AuthorDiversityReranker;
import com.fyl.ranking.scoring.HeuristicActionProbabilityModel;
import com.fyl.ranking.scoring.WeightedScorer;
import com.fyl.ranking.sources.CandidateFactory;
import com.fyl.ranking.sources.InNetworkSource;
import com.fyl.ranking.sources.OutOfNetworkSource;
import com.fyl.ranking.store.InMemoryFeedStore;
import com.fyl.ranking.store.StoreProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class HomeMixerTest {
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private ExternalContentSource externalSource;

    private Clock clock;
    private InMemoryFeedStore store;
    private MixerProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private HomeMixer mixer;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
        store = new InMemoryFeedStore(new StoreProperties(), clock);
        properties = new MixerProperties();
        meterRegistry = new SimpleMeterRegistry();
        mixer = buildMixer(List.of());

        store.putUser(User.of("me", "me", List.of("a", "b", "c")));
        store.putUser(User.of("a", "alice", List.of()));
        store.putUser(User.of("b", "bob", List.of()));
        store.putUser(User.of("c", "carol", List.of()));
        store.putUser(User.of("x", "xavier", List.of()));
        store.putUser(User.of("loner", "loner", List.of()));

        store.putPost(Post.original("a1", "a", "alice 1", List.of(), minutesAgo(1)));
        store.putPost(Post.original("a2", "a", "alice 2", List.of(), minutesAgo(2)));
        store.putPost(Post.original("b1", "b", "bob 1", List.of(), minutesAgo(3)));
        store.putPost(Post.original("b2", "b", "bob 2", List.of(), minutesAgo(4)));
        store.putPost(Post.original("c1", "c", "carol 1", List.of(), minutesAgo(5)));
        store.putPost(Post.original("c2", "c", "carol 2", List.of(), minutesAgo(6)));
    }

    @Test
    void freshInNetworkPostsInterleaveAuthors() {
        FeedResponse response = mixer.getFeed("me", null, 10, null, true, true);

        assertThat(postIds(response)).containsExactly("a1", "b1", "c1", "a2", "b2", "c2");
        Set<String> topAuthors = new HashSet<>();
        for (int i = 0; i < 3; i++) {
            topAuthors.add(response.getItems().get(i).getPost().getAuthorId());
        }
        assertEquals(3, topAuthors.size());
        assertNull(response.getNextCursor());
    }

    @Test
    void sameInputsProduceIdenticalOutput() throws Exception {
        store.putPost(Post.original("x1", "x", "global", List.of(), minutesAgo(7)));
        store.addEngagement(new Engagement("b", "x1", EngagementType.LIKE, NOW));
        ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();

        String first = mapper.writeValueAsString(mixer.getFeed("me", null, 20, null, true, false));
        String second = mapper.writeValueAsString(mixer.getFeed("me", null, 20, null, true, false));

        assertEquals(first, second);
    }

    @Test
    void neverReturnsViewerOwnPosts() {
        store.putPost(Post.original("mine", "me", "my post", List.of(), minutesAgo(0)));

        FeedResponse response = mixer.getFeed("me", null, 50, null, true, false);

        assertThat(response.getItems()).noneMatch(item -> item.getPost().getAuthorId().equals("me"));
    }

    @Test
    void excludesSeenPosts() {
        FeedResponse response = mixer.getFeed("me", null, 50, Set.of("a1", "c2"), true, false);

        assertThat(postIds(response)).doesNotContain("a1", "c2").contains("a2", "b1");
    }

    @Test
    void forYouMixesInOutOfNetworkPosts() {
        store.putPost(Post.original("x1", "x", "global", List.of(), minutesAgo(1)));

        FeedResponse forYou = mixer.getFeed("me", null, 50, null, true, false);
        FeedResponse following = mixer.getFeed("me", null, 50, null, true, true);

        FeedItem global = forYou.getItems().stream()
            .filter(item -> item.getPost().getId().equals("x1"))
            .findFirst()
            .orElseThrow();
        assertEquals(CandidateSource.OUT_OF_NETWORK, global.getRankingExplanation().getSource());
        assertThat(postIds(following)).doesNotContain("x1");
    }

    @Test
    void followingOnlyWithNoFollowsIsEmpty() {
        store.putPost(Post.original("x1", "x", "global", List.of(), minutesAgo(1)));

        FeedResponse response = mixer.getFeed("loner", null, 50, null, true, true);

        assertTrue(response.getItems().isEmpty());
    }

    @Test
    void explanationsDoNotAffectOrder() {
        FeedResponse withExplanations = mixer.getFeed("me", null, 10, null, true, false);
        FeedResponse without = mixer.getFeed("me", null, 10, null, false, false);

        assertEquals(postIds(withExplanations), postIds(without));
        assertThat(without.getItems()).allMatch(item -> item.getRankingExplanation() == null);
    }

    @Test
    void explanationsCarryRanksAndReconstructScores() {
        FeedResponse response = mixer.getFeed("me", null, 10, null, true, false);

        for (int i = 0; i < response.getItems().size(); i++) {
            RankingExplanation explanation = response.getItems().get(i).getRankingExplanation();
            assertEquals(i + 1, explanation.getRank());
            assertEquals(explanation.getFinalScore(), explanation.reconstructFinalScore(), 1e-9);
            if (i > 0) {
                RankingExplanation previous = response.getItems().get(i - 1).getRankingExplanation();
                assertTrue(previous.getFinalScore() >= explanation.getFinalScore());
            }
        }
    }

    @Test
    void limitIsClampedToConfiguredRange() {
        properties.setMaxLimit(2);

        assertEquals(2, mixer.getFeed("me", null, 100, null, true, false).getItems().size());
        assertTrue(mixer.getFeed("me", null, -5, null, true, false).getItems().isEmpty());
        assertTrue(mixer.getFeed("me", null, 0, null, true, false).getItems().isEmpty());
    }

    @Test
    void dropsPostsOlderThanMaxAge() {
        properties.setMaxAge(Duration.ofMinutes(3));

        FeedResponse response = mixer.getFeed("me", null, 10, null, true, true);

        assertThat(postIds(response)).containsExactlyInAnyOrder("a1", "a2", "b1");
    }

    @Test
    void hydratesRepliesQuotesAndLiveCounts() {
        store.putPost(Post.original("x1", "x", "original", List.of(), minutesAgo(30)));
        store.putPost(Post.reply("r1", "a", "reply", "x1", minutesAgo(0)));
        store.putPost(Post.quote("q1", "b", "quote", "x1", minutesAgo(0)));
        store.addEngagement(new Engagement("c", "r1", EngagementType.LIKE, NOW));
        store.addEngagement(new Engagement("x", "r1", EngagementType.LIKE, NOW));
        store.addEngagement(new Engagement("x", "r1", EngagementType.REPLY, NOW));

        FeedResponse response = mixer.getFeed("me", null, 50, null, true, true);

        FeedItem reply = itemFor(response, "r1");
        assertEquals(2, reply.getPost().getLikeCount());
        assertEquals(1, reply.getPost().getReplyCount());
        assertEquals("alice", reply.getPost().getAuthor().handle());
        assertNotNull(reply.getParentPost());
        assertEquals("x1", reply.getParentPost().getId());
        assertEquals("xavier", reply.getParentPost().getAuthor().handle());
        assertNull(reply.getQuotedPost());

        FeedItem quote = itemFor(response, "q1");
        assertEquals("x1", quote.getQuotedPost().getId());
        assertNull(quote.getParentPost());
    }

    @Test
    void availableExternalSourceIsAppendedToForYou() {
        Post headline = Post.original("news_1", "news_api", "Headline", List.of(), minutesAgo(0));
        User newsAuthor = new User("news_api", "news_api", "Wire", "", null, List.of(), null, List.of(), 0, 0);
        Candidate external = new Candidate(
            headline,
            newsAuthor,
            CandidateSource.OUT_OF_NETWORK,
            Map.of(EngagementType.LIKE, 0),
            CandidateFeatures.of("newsapi")
        );
        when(externalSource.isAvailable()).thenReturn(true);
        when(externalSource.name()).thenReturn("newsapi");
        when(externalSource.fetch(properties.getExternalLimit())).thenReturn(List.of(external));
        mixer = buildMixer(List.of(externalSource));

        FeedItem item = itemFor(mixer.getFeed("me", null, 50, null, true, false), "news_1");

        assertEquals("Wire", item.getPost().getAuthor().displayName());
        assertEquals("newsapi", item.getRankingExplanation().getExtensions().get("provider"));
    }

    @Test
    void externalSourceIsSkippedWhenUnavailableOrFollowingOnly() {
        when(externalSource.isAvailable()).thenReturn(false);
        mixer = buildMixer(List.of(externalSource));

        mixer.getFeed("me", null, 50, null, true, false);
        mixer.getFeed("me", null, 50, null, true, true);

        verify(externalSource, never()).fetch(anyInt());
    }

    @Test
    void preferencesChangeTheRanking() {
        store.putPost(Post.original("x1", "x", "popular", List.of(), minutesAgo(50)));
        for (int i = 0; i < 30; i++) {
            store.addEngagement(new Engagement("fan" + i, "x1", EngagementType.LIKE, NOW));
        }
        AlgorithmPreferences global = AlgorithmPreferences.defaults();
        global.setFriendsVsGlobal(1.0);
        global.setRecencyVsPopularity(1.0);

        FeedResponse response = mixer.getFeed("me", global, 10, null, true, false);

        assertEquals("x1", response.getItems().get(0).getPost().getId());
    }

    @Test
    void recordsRequestMetrics() {
        mixer.getFeed("me", null, 3, null, true, false);

        assertEquals(1.0, meterRegistry.counter("feed_requests_total", "following_only", "false").count(), 0.0);
        assertEquals(6.0, meterRegistry.counter("feed_candidates_sourced_total").count(), 0.0);
        assertEquals(3.0, meterRegistry.counter("feed_items_returned_total").count(), 0.0);
    }

    private HomeMixer buildMixer(List<ExternalContentSource> externalSources) {
        CandidateFactory factory = new CandidateFactory(store);
        CandidateSourcer sourcer = new CandidateSourcer(
            new InNetworkSource(store, factory),
            new OutOfNetworkSource(store, factory),
            externalSources,
            properties
        );
        return new HomeMixer(
            sourcer,
            PreScoringFilterChain.standard(),
            new WeightedScorer(new HeuristicActionProbabilityModel()),
            new AuthorDiversityReranker(),
            new FeedHydrator(store),
            properties,
            clock,
            meterRegistry
        );
    }

    private static FeedItem itemFor(FeedResponse response, String postId) {
        return response.getItems().stream()
            .filter(item -> item.getPost().getId().equals(postId))
            .findFirst()
            .orElseThrow();
    }

    private static List<String> postIds(FeedResponse response) {
        List<String> ids = new ArrayList<>();
        for (FeedItem item : response.getItems()) {
            ids.add(item.getPost().getId());
        }
        return ids;
    }

    private static Instant minutesAgo(long minutes) {
        return NOW.minus(Duration.ofMinutes(minutes));
    }
}
