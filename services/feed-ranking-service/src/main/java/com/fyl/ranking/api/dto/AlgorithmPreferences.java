package com.fyl.ranking.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * User-facing ranking knobs. Every value is nominally in [0, 1]; nothing here is validated and
 * out-of-range values simply bias the ranking.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AlgorithmPreferences {
    /** 0 = recency, 1 = popularity. */
    @JsonProperty("recency_vs_popularity")
    private double recencyVsPopularity = 0.3;

    /** 0 = mostly following, 1 = more out-of-network. */
    @JsonProperty("friends_vs_global")
    private double friendsVsGlobal = 0.4;

    @JsonProperty("niche_vs_viral")
    private double nicheVsViral = 0.5;

    @JsonProperty("tech_weight")
    private double techWeight = 0.2;

    @JsonProperty("politics_weight")
    private double politicsWeight = 0.2;

    @JsonProperty("culture_weight")
    private double cultureWeight = 0.2;

    @JsonProperty("memes_weight")
    private double memesWeight = 0.2;

    @JsonProperty("finance_weight")
    private double financeWeight = 0.2;

    /** 0 = allow author stacking, 1 = strong author diversity. */
    @JsonProperty("diversity_strength")
    private double diversityStrength = 0.6;

    @JsonProperty("exploration")
    private double exploration = 0.3;

    @JsonProperty("negative_signal_strength")
    private double negativeSignalStrength = 0.8;

    public static AlgorithmPreferences defaults() {
        return new AlgorithmPreferences();
    }

    public AlgorithmPreferences copy() {
        AlgorithmPreferences copy = new AlgorithmPreferences();
        copy.recencyVsPopularity = recencyVsPopularity;
        copy.friendsVsGlobal = friendsVsGlobal;
        copy.nicheVsViral = nicheVsViral;
        copy.techWeight = techWeight;
        copy.politicsWeight = politicsWeight;
        copy.cultureWeight = cultureWeight;
        copy.memesWeight = memesWeight;
        copy.financeWeight = financeWeight;
        copy.diversityStrength = diversityStrength;
        copy.exploration = exploration;
        copy.negativeSignalStrength = negativeSignalStrength;
        return copy;
    }

    public double getRecencyVsPopularity() {
        return recencyVsPopularity;
    }

    public void setRecencyVsPopularity(double recencyVsPopularity) {
        this.recencyVsPopularity = recencyVsPopularity;
    }

    public double getFriendsVsGlobal() {
        return friendsVsGlobal;
    }

    public void setFriendsVsGlobal(double friendsVsGlobal) {
        this.friendsVsGlobal = friendsVsGlobal;
    }

    public double getNicheVsViral() {
        return nicheVsViral;
    }

    public void setNicheVsViral(double nicheVsViral) {
        this.nicheVsViral = nicheVsViral;
    }

    public double getTechWeight() {
        return techWeight;
    }

    public void setTechWeight(double techWeight) {
        this.techWeight = techWeight;
    }

    public double getPoliticsWeight() {
        return politicsWeight;
    }

    public void setPoliticsWeight(double politicsWeight) {
        this.politicsWeight = politicsWeight;
    }

    public double getCultureWeight() {
        return cultureWeight;
    }

    public void setCultureWeight(double cultureWeight) {
        this.cultureWeight = cultureWeight;
    }

    public double getMemesWeight() {
        return memesWeight;
    }

    public void setMemesWeight(double memesWeight) {
        this.memesWeight = memesWeight;
    }

    public double getFinanceWeight() {
        return financeWeight;
    }

    public void setFinanceWeight(double financeWeight) {
        this.financeWeight = financeWeight;
    }

    public double getDiversityStrength() {
        return diversityStrength;
    }

    public void setDiversityStrength(double diversityStrength) {
        this.diversityStrength = diversityStrength;
    }

    public double getExploration() {
        return exploration;
    }

    public void setExploration(double exploration) {
        this.exploration = exploration;
    }

    public double getNegativeSignalStrength() {
        return negativeSignalStrength;
    }

    public void setNegativeSignalStrength(double negativeSignalStrength) {
        this.negativeSignalStrength = negativeSignalStrength;
    }
}
