package com.fyl.ranking.mixer;

import com.fyl.ranking.api.dto.AlgorithmPreferences;
import com.fyl.ranking.api.dto.FeedItem;
import com.fyl.ranking.api.dto.FeedResponse;
import com.fyl.ranking.candidate.Candidate;
import com.fyl.ranking.candidate.ScoredCandidate;
import com.fyl.ranking.filters.FilterContext;
import com.fyl.ranking.filters.PreScoringFilterChain;
import com.fyl.ranking.scoring.AuthorDiversityReranker;
import com.fyl.ranking.scoring.WeightedScorer;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Orchestrates the For You pipeline: sources, pre-scoring filters, weighted scoring, author
 * diversity, top-K selection and hydration.
 *
 * <p>The mixer assumes the viewer exists. For an unknown viewer every store lookup comes back
 * empty and the result is an empty feed; callers that need a hard failure check first.
 */
@Service
public class HomeMixer {
    private static final Logger log = LoggerFactory.getLogger(HomeMixer.class);

    private final CandidateSourcer candidateSourcer;
    private final PreScoringFilterChain filterChain;
    private final WeightedScorer weightedScorer;
    private final AuthorDiversityReranker diversityReranker;
    private final FeedHydrator hydrator;
    private final MixerProperties properties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public HomeMixer(
        CandidateSourcer candidateSourcer,
        PreScoringFilterChain filterChain,
        WeightedScorer weightedScorer,
        AuthorDiversityReranker diversityReranker,
        FeedHydrator hydrator,
        MixerProperties properties,
        Clock clock,
        MeterRegistry meterRegistry
    ) {
        this.candidateSourcer = candidateSourcer;
        this.filterChain = filterChain;
        this.weightedScorer = weightedScorer;
        this.diversityReranker = diversityReranker;
        this.hydrator = hydrator;
        this.properties = properties;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    public FeedResponse getFeed(
        String userId,
        AlgorithmPreferences preferences,
        int limit,
        Set<String> seenPostIds,
        boolean includeExplanations,
        boolean followingOnly
    ) {
        return getFeed(new FeedQuery(userId, preferences, limit, seenPostIds, includeExplanations, followingOnly));
    }

    public FeedResponse getFeed(FeedQuery query) {
        long started = System.nanoTime();
        meterRegistry.counter("feed_requests_total", "following_only", String.valueOf(query.followingOnly())).increment();
        AlgorithmPreferences prefs = query.preferences() == null ? AlgorithmPreferences.defaults() : query.preferences();
        Instant now = clock.instant();

        List<Candidate> candidates = query.followingOnly()
            ? candidateSourcer.followingOnly(query.userId())
            : candidateSourcer.forYou(query.userId());
        meterRegistry.counter("feed_candidates_sourced_total").increment(candidates.size());

        FilterContext filterContext = new FilterContext(query.userId(), now, properties.getMaxAge(), query.seenPostIds());
        List<Candidate> filtered = filterChain.apply(candidates, filterContext);
        meterRegistry.counter("feed_candidates_filtered_total").increment(candidates.size() - filtered.size());

        List<ScoredCandidate> scored = weightedScorer.score(filtered, prefs, now);
        List<ScoredCandidate> ranked = diversityReranker.rerank(scored, prefs);

        int size = resolveLimit(query.limit());
        int selected = Math.min(size, ranked.size());
        List<FeedItem> items = new ArrayList<>(selected);
        for (int i = 0; i < selected; i++) {
            items.add(hydrator.hydrate(ranked.get(i), query.includeExplanations()));
        }
        meterRegistry.counter("feed_items_returned_total").increment(items.size());

        FeedResponse response = new FeedResponse();
        response.setItems(items);
        response.setNextCursor(null);

        if (log.isDebugEnabled()) {
            long tookMs = (System.nanoTime() - started) / 1_000_000L;
            log.debug(
                "feed for {}: sourced={} filtered={} returned={} following_only={} took_ms={}",
                query.userId(),
                candidates.size(),
                filtered.size(),
                items.size(),
                query.followingOnly(),
                tookMs
            );
        }
        return response;
    }

    private int resolveLimit(int requested) {
        int size = Math.max(requested, 0);
        if (size > properties.getMaxLimit()) {
            log.debug("feed limit {} capped at {}", requested, properties.getMaxLimit());
            size = properties.getMaxLimit();
        }
        return size;
    }
}
