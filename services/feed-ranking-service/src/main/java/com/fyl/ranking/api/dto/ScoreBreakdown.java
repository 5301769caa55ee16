package com.fyl.ranking.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;

public class ScoreBreakdown {
    @JsonProperty("in_network_multiplier")
    private double inNetworkMultiplier = 1.0;

    @JsonProperty("weighted_action_sum")
    private double weightedActionSum;

    @JsonProperty("topic_adjustment")
    private double topicAdjustment;

    @JsonProperty("recency_adjustment")
    private double recencyAdjustment;

    @JsonProperty("pre_diversity_score")
    private double preDiversityScore;

    /** Amount given back when the diversity penalty would have crossed the score floor. */
    @JsonProperty("floor_adjustment")
    private double floorAdjustment;

    private Map<String, Double> probabilities = new LinkedHashMap<>();

    public ScoreBreakdown copy() {
        ScoreBreakdown copy = new ScoreBreakdown();
        copy.inNetworkMultiplier = inNetworkMultiplier;
        copy.weightedActionSum = weightedActionSum;
        copy.topicAdjustment = topicAdjustment;
        copy.recencyAdjustment = recencyAdjustment;
        copy.preDiversityScore = preDiversityScore;
        copy.floorAdjustment = floorAdjustment;
        copy.probabilities = probabilities == null ? new LinkedHashMap<>() : new LinkedHashMap<>(probabilities);
        return copy;
    }

    public double getInNetworkMultiplier() {
        return inNetworkMultiplier;
    }

    public void setInNetworkMultiplier(double inNetworkMultiplier) {
        this.inNetworkMultiplier = inNetworkMultiplier;
    }

    public double getWeightedActionSum() {
        return weightedActionSum;
    }

    public void setWeightedActionSum(double weightedActionSum) {
        this.weightedActionSum = weightedActionSum;
    }

    public double getTopicAdjustment() {
        return topicAdjustment;
    }

    public void setTopicAdjustment(double topicAdjustment) {
        this.topicAdjustment = topicAdjustment;
    }

    public double getRecencyAdjustment() {
        return recencyAdjustment;
    }

    public void setRecencyAdjustment(double recencyAdjustment) {
        this.recencyAdjustment = recencyAdjustment;
    }

    public double getPreDiversityScore() {
        return preDiversityScore;
    }

    public void setPreDiversityScore(double preDiversityScore) {
        this.preDiversityScore = preDiversityScore;
    }

    public double getFloorAdjustment() {
        return floorAdjustment;
    }

    public void setFloorAdjustment(double floorAdjustment) {
        this.floorAdjustment = floorAdjustment;
    }

    public Map<String, Double> getProbabilities() {
        return probabilities;
    }

    public void setProbabilities(Map<String, Double> probabilities) {
        this.probabilities = probabilities;
    }
}
