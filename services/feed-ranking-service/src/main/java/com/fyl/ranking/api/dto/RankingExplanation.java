package com.fyl.ranking.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fyl.ranking.candidate.CandidateSource;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Why a post appeared at its rank. The recorded terms decompose {@code final_score} exactly:
 *
 * <pre>
 * final_score = sum(action_scores.contribution) * in_network_multiplier
 *             + topic_adjustment + recency_adjustment
 *             - diversity_penalty + floor_adjustment
 * </pre>
 */
public class RankingExplanation {
    @JsonProperty("post_id")
    private String postId;

    @JsonProperty("final_score")
    private double finalScore;

    private int rank;
    private CandidateSource source;

    @JsonProperty("action_scores")
    private List<ActionScore> actionScores = new ArrayList<>();

    @JsonProperty("diversity_penalty")
    private double diversityPenalty;

    @JsonProperty("recency_boost")
    private double recencyBoost;

    @JsonProperty("topic_boost")
    private double topicBoost;

    private ScoreBreakdown breakdown = new ScoreBreakdown();

    /** Unstable; keys may change without notice. */
    private Map<String, Object> extensions = new LinkedHashMap<>();

    public RankingExplanation copy() {
        RankingExplanation copy = new RankingExplanation();
        copy.postId = postId;
        copy.finalScore = finalScore;
        copy.rank = rank;
        copy.source = source;
        copy.actionScores = new ArrayList<>();
        if (actionScores != null) {
            for (ActionScore score : actionScores) {
                copy.actionScores.add(
                    new ActionScore(score.getAction(), score.getWeight(), score.getProbability(), score.getContribution())
                );
            }
        }
        copy.diversityPenalty = diversityPenalty;
        copy.recencyBoost = recencyBoost;
        copy.topicBoost = topicBoost;
        copy.breakdown = breakdown == null ? new ScoreBreakdown() : breakdown.copy();
        copy.extensions = extensions == null ? new LinkedHashMap<>() : new LinkedHashMap<>(extensions);
        return copy;
    }

    /**
     * Recomputes the final score from the recorded terms alone.
     */
    @JsonIgnore
    public double reconstructFinalScore() {
        double actionSum = 0.0;
        for (ActionScore score : actionScores) {
            actionSum += score.getContribution();
        }
        return actionSum * breakdown.getInNetworkMultiplier()
            + breakdown.getTopicAdjustment()
            + breakdown.getRecencyAdjustment()
            - diversityPenalty
            + breakdown.getFloorAdjustment();
    }

    public String getPostId() {
        return postId;
    }

    public void setPostId(String postId) {
        this.postId = postId;
    }

    public double getFinalScore() {
        return finalScore;
    }

    public void setFinalScore(double finalScore) {
        this.finalScore = finalScore;
    }

    public int getRank() {
        return rank;
    }

    public void setRank(int rank) {
        this.rank = rank;
    }

    public CandidateSource getSource() {
        return source;
    }

    public void setSource(CandidateSource source) {
        this.source = source;
    }

    public List<ActionScore> getActionScores() {
        return actionScores;
    }

    public void setActionScores(List<ActionScore> actionScores) {
        this.actionScores = actionScores;
    }

    public double getDiversityPenalty() {
        return diversityPenalty;
    }

    public void setDiversityPenalty(double diversityPenalty) {
        this.diversityPenalty = diversityPenalty;
    }

    public double getRecencyBoost() {
        return recencyBoost;
    }

    public void setRecencyBoost(double recencyBoost) {
        this.recencyBoost = recencyBoost;
    }

    public double getTopicBoost() {
        return topicBoost;
    }

    public void setTopicBoost(double topicBoost) {
        this.topicBoost = topicBoost;
    }

    public ScoreBreakdown getBreakdown() {
        return breakdown;
    }

    public void setBreakdown(ScoreBreakdown breakdown) {
        this.breakdown = breakdown;
    }

    public Map<String, Object> getExtensions() {
        return extensions;
    }

    public void setExtensions(Map<String, Object> extensions) {
        this.extensions = extensions;
    }
}
