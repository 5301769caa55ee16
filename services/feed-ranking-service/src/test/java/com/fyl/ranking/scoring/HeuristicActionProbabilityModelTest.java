package com.fyl.ranking.scoring;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fyl.ranking.api.dto.AlgorithmPreferences;
import com.fyl.ranking.candidate.Candidate;
import com.fyl.ranking.candidate.CandidateSource;
import com.fyl.ranking.model.EngagementType;
import com.fyl.ranking.model.Post;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class HeuristicActionProbabilityModelTest {
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final double EPS = 1e-9;

    private final HeuristicActionProbabilityModel model = new HeuristicActionProbabilityModel();

    @Test
    void recencyDecaysHyperbolicallyByHour() {
        assertEquals(1.0, HeuristicActionProbabilityModel.recencyScore(NOW, NOW), EPS);
        assertEquals(0.5, HeuristicActionProbabilityModel.recencyScore(NOW.minus(Duration.ofHours(1)), NOW), EPS);
        assertEquals(0.2, HeuristicActionProbabilityModel.recencyScore(NOW.minus(Duration.ofHours(4)), NOW), EPS);
    }

    @Test
    void futurePostsCountAsBrandNew() {
        assertEquals(1.0, HeuristicActionProbabilityModel.recencyScore(NOW.plus(Duration.ofHours(2)), NOW), EPS);
    }

    @Test
    void popularityStartsAtHalfAndSaturates() {
        assertEquals(0.5, HeuristicActionProbabilityModel.popularityScore(0, 0, 0), EPS);
        assertTrue(HeuristicActionProbabilityModel.popularityScore(1000, 1000, 1000) <= 1.0);
        assertTrue(
            HeuristicActionProbabilityModel.popularityScore(10, 0, 0) > HeuristicActionProbabilityModel.popularityScore(5, 0, 0)
        );
    }

    @Test
    void freshPostWithoutEngagementUsesDefaultBlend() {
        Candidate candidate = candidate(NOW, Map.of());

        Map<ActionType, Double> probabilities = model.predict(candidate, AlgorithmPreferences.defaults(), NOW);

        // base = 0.7 * recency(1.0) + 0.3 * popularity(0.5)
        double base = 0.85;
        assertEquals(ActionType.values().length, probabilities.size());
        assertEquals(base * 0.4, probabilities.get(ActionType.LIKE), EPS);
        assertEquals(base * 0.2, probabilities.get(ActionType.REPOST), EPS);
        assertEquals(base * 0.5, probabilities.get(ActionType.CLICK), EPS);
        assertEquals(0.05 * 0.8, probabilities.get(ActionType.NOT_INTERESTED), EPS);
        assertEquals(0.01 * 0.8, probabilities.get(ActionType.REPORT), EPS);
    }

    @Test
    void likesRaiseLikeProbabilityUpToCap() {
        AlgorithmPreferences prefs = AlgorithmPreferences.defaults();
        double few = model.predict(candidate(NOW, Map.of(EngagementType.LIKE, 5)), prefs, NOW).get(ActionType.LIKE);
        double many = model.predict(candidate(NOW, Map.of(EngagementType.LIKE, 20)), prefs, NOW).get(ActionType.LIKE);
        double capped = model.predict(candidate(NOW, Map.of(EngagementType.LIKE, 400)), prefs, NOW).get(ActionType.LIKE);

        assertTrue(many > few);
        assertTrue(capped >= many);
        assertTrue(capped <= 0.7 + EPS);
    }

    @Test
    void negativeProbabilitiesScaleWithNegativeSignalStrength() {
        AlgorithmPreferences prefs = AlgorithmPreferences.defaults();
        prefs.setNegativeSignalStrength(0.0);

        Map<ActionType, Double> probabilities = model.predict(candidate(NOW, Map.of()), prefs, NOW);

        List<ActionType> negative = List.of(
            ActionType.NOT_INTERESTED,
            ActionType.BLOCK_AUTHOR,
            ActionType.MUTE_AUTHOR,
            ActionType.REPORT
        );
        for (ActionType action : negative) {
            assertEquals(0.0, probabilities.get(action), EPS);
        }
    }

    @Test
    void recencyPreferenceFavoursNewerPosts() {
        AlgorithmPreferences prefs = AlgorithmPreferences.defaults();
        prefs.setRecencyVsPopularity(0.0);

        double fresh = model.predict(candidate(NOW, Map.of()), prefs, NOW).get(ActionType.LIKE);
        double older = model.predict(candidate(NOW.minus(Duration.ofHours(6)), Map.of()), prefs, NOW).get(ActionType.LIKE);

        assertTrue(fresh > older);
    }

    private static Candidate candidate(Instant createdAt, Map<EngagementType, Integer> counts) {
        Post post = Post.original("p1", "u2", "text", List.of(), createdAt);
        return new Candidate(post, null, CandidateSource.OUT_OF_NETWORK, counts, null);
    }
}
