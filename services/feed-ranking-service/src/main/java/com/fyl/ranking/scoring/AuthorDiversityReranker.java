package com.fyl.ranking.scoring;

import com.fyl.ranking.api.dto.AlgorithmPreferences;
import com.fyl.ranking.api.dto.RankingExplanation;
import com.fyl.ranking.candidate.ScoredCandidate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Attenuates repeated authors. The n-th post by an author (in score order) loses
 * {@code (n - 1) * diversity_strength * 0.15}; the penalty alone never drags a score below
 * {@code min(score, 0)}. Ranks are reassigned after the final sort.
 */
@Component
public class AuthorDiversityReranker {
    static final double PENALTY_PER_REPEAT = 0.15;

    private static final Comparator<ScoredCandidate> BY_SCORE_DESC =
        Comparator.comparingDouble(ScoredCandidate::finalScore).reversed();

    public List<ScoredCandidate> rerank(List<ScoredCandidate> scored, AlgorithmPreferences preferences) {
        List<ScoredCandidate> byScore = new ArrayList<>(scored);
        // List.sort is stable: equal scores keep their input order
        byScore.sort(BY_SCORE_DESC);

        double strength = preferences.getDiversityStrength();
        Map<String, Integer> occurrences = new HashMap<>();
        List<ScoredCandidate> penalized = new ArrayList<>(byScore.size());
        for (ScoredCandidate entry : byScore) {
            int seen = occurrences.merge(entry.authorId(), 1, Integer::sum);
            double penalty = (seen - 1) * strength * PENALTY_PER_REPEAT;
            double floor = Math.min(entry.finalScore(), 0.0);
            double penalizedScore = entry.finalScore() - penalty;
            double newScore = Math.max(floor, penalizedScore);

            RankingExplanation explanation = entry.explanation().copy();
            explanation.setDiversityPenalty(penalty);
            explanation.getBreakdown().setFloorAdjustment(newScore - penalizedScore);
            explanation.setFinalScore(newScore);
            penalized.add(new ScoredCandidate(entry.candidate(), newScore, explanation));
        }

        penalized.sort(BY_SCORE_DESC);
        for (int i = 0; i < penalized.size(); i++) {
            penalized.get(i).explanation().setRank(i + 1);
        }
        return penalized;
    }
}
