package com.fyl.ranking.scoring;

import com.fyl.ranking.api.dto.ActionScore;
import com.fyl.ranking.api.dto.AlgorithmPreferences;
import com.fyl.ranking.api.dto.RankingExplanation;
import com.fyl.ranking.api.dto.ScoreBreakdown;
import com.fyl.ranking.candidate.Candidate;
import com.fyl.ranking.candidate.CandidateSource;
import com.fyl.ranking.candidate.ScoredCandidate;
import com.fyl.ranking.model.Topic;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Weighted sum of predicted action probabilities, scaled for in-network posts and nudged by topic
 * affinity and recency. Every term lands in the explanation verbatim.
 */
@Component
public class WeightedScorer {
    static final double NEUTRAL_BOOST = 0.5;
    static final double TOPIC_ADJUSTMENT_WEIGHT = 0.2;
    static final double RECENCY_ADJUSTMENT_WEIGHT = 0.1;
    static final double IN_NETWORK_BOOST = 0.5;
    // news and other have no slider
    static final double UNWEIGHTED_TOPIC_WEIGHT = 0.1;

    private final ActionProbabilityModel probabilityModel;

    public WeightedScorer(ActionProbabilityModel probabilityModel) {
        this.probabilityModel = probabilityModel;
    }

    public List<ScoredCandidate> score(List<Candidate> candidates, AlgorithmPreferences preferences, Instant now) {
        List<ScoredCandidate> out = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates) {
            out.add(score(candidate, preferences, now));
        }
        return out;
    }

    public ScoredCandidate score(Candidate candidate, AlgorithmPreferences preferences, Instant now) {
        Map<ActionType, Double> probabilities = probabilityModel.predict(candidate, preferences, now);
        double topicBoost = topicBoost(candidate.getPost().topics(), preferences);
        double recencyBoost = HeuristicActionProbabilityModel.recencyScore(candidate.getPost().createdAt(), now);

        double weightedSum = 0.0;
        List<ActionScore> actionScores = new ArrayList<>(ActionType.values().length);
        Map<String, Double> probabilityMap = new LinkedHashMap<>();
        for (ActionType action : ActionType.values()) {
            Double raw = probabilities.get(action);
            double probability = raw == null ? 0.0 : raw;
            double contribution = action.weight() * probability;
            weightedSum += contribution;
            actionScores.add(new ActionScore(action.key(), action.weight(), probability, contribution));
            probabilityMap.put(action.key(), probability);
        }

        double multiplier = inNetworkMultiplier(candidate.getSource(), preferences);
        double topicAdjustment = TOPIC_ADJUSTMENT_WEIGHT * (topicBoost - NEUTRAL_BOOST);
        double recencyAdjustment = RECENCY_ADJUSTMENT_WEIGHT * (recencyBoost - NEUTRAL_BOOST);
        double score = weightedSum * multiplier + topicAdjustment + recencyAdjustment;

        ScoreBreakdown breakdown = new ScoreBreakdown();
        breakdown.setInNetworkMultiplier(multiplier);
        breakdown.setWeightedActionSum(weightedSum);
        breakdown.setTopicAdjustment(topicAdjustment);
        breakdown.setRecencyAdjustment(recencyAdjustment);
        breakdown.setPreDiversityScore(score);
        breakdown.setFloorAdjustment(0.0);
        breakdown.setProbabilities(probabilityMap);

        RankingExplanation explanation = new RankingExplanation();
        explanation.setPostId(candidate.getPostId());
        explanation.setFinalScore(score);
        explanation.setRank(0);
        explanation.setSource(candidate.getSource());
        explanation.setActionScores(actionScores);
        explanation.setDiversityPenalty(0.0);
        explanation.setRecencyBoost(recencyBoost);
        explanation.setTopicBoost(topicBoost);
        explanation.setBreakdown(breakdown);
        Map<String, Object> extensions = new LinkedHashMap<>();
        extensions.put("model_id", probabilityModel.modelId());
        if (candidate.getFeatures().provider() != null) {
            extensions.put("provider", candidate.getFeatures().provider());
        }
        explanation.setExtensions(extensions);

        return new ScoredCandidate(candidate, score, explanation);
    }

    /**
     * 1.0 out of network; up to 1.5 in network as {@code friends_vs_global} approaches 0.
     */
    public static double inNetworkMultiplier(CandidateSource source, AlgorithmPreferences preferences) {
        if (source != CandidateSource.IN_NETWORK) {
            return 1.0;
        }
        return 1.0 + (1.0 - preferences.getFriendsVsGlobal()) * IN_NETWORK_BOOST;
    }

    public static double topicBoost(List<Topic> topics, AlgorithmPreferences preferences) {
        if (topics == null || topics.isEmpty()) {
            return NEUTRAL_BOOST;
        }
        double total = 0.0;
        for (Topic topic : topics) {
            total += topicWeight(topic, preferences);
        }
        return total / topics.size();
    }

    private static double topicWeight(Topic topic, AlgorithmPreferences preferences) {
        return switch (topic) {
            case TECH -> preferences.getTechWeight();
            case POLITICS -> preferences.getPoliticsWeight();
            case CULTURE -> preferences.getCultureWeight();
            case MEMES -> preferences.getMemesWeight();
            case FINANCE -> preferences.getFinanceWeight();
            default -> UNWEIGHTED_TOPIC_WEIGHT;
        };
    }
}
