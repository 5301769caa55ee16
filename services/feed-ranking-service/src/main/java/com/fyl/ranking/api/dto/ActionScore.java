package com.fyl.ranking.api.dto;

public class ActionScore {
    private String action;
    private double weight;
    private double probability;
    private double contribution;

    public ActionScore() {
    }

    public ActionScore(String action, double weight, double probability, double contribution) {
        this.action = action;
        this.weight = weight;
        this.probability = probability;
        this.contribution = contribution;
    }

    public String getAction() {
        return action;
    }

    public void setAction(String action) {
        this.action = action;
    }

    public double getWeight() {
        return weight;
    }

    public void setWeight(double weight) {
        this.weight = weight;
    }

    public double getProbability() {
        return probability;
    }

    public void setProbability(double probability) {
        this.probability = probability;
    }

    public double getContribution() {
        return contribution;
    }

    public void setContribution(double contribution) {
        this.contribution = contribution;
    }
}
