package com.fyl.ranking.mixer;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ranking.mixer")
public class MixerProperties {
    private int limitInNetwork = 200;
    private int limitInNetworkFollowingOnly = 300;
    private int limitOutOfNetwork = 150;
    private int limitPerAuthor = 20;
    private int externalLimit = 25;
    private Duration maxAge = Duration.ofHours(168);
    private int defaultLimit = 50;
    private int maxLimit = 200;

    public int getLimitInNetwork() {
        return limitInNetwork;
    }

    public void setLimitInNetwork(int limitInNetwork) {
        this.limitInNetwork = limitInNetwork;
    }

    public int getLimitInNetworkFollowingOnly() {
        return limitInNetworkFollowingOnly;
    }

    public void setLimitInNetworkFollowingOnly(int limitInNetworkFollowingOnly) {
        this.limitInNetworkFollowingOnly = limitInNetworkFollowingOnly;
    }

    public int getLimitOutOfNetwork() {
        return limitOutOfNetwork;
    }

    public void setLimitOutOfNetwork(int limitOutOfNetwork) {
        this.limitOutOfNetwork = limitOutOfNetwork;
    }

    public int getLimitPerAuthor() {
        return limitPerAuthor;
    }

    public void setLimitPerAuthor(int limitPerAuthor) {
        this.limitPerAuthor = limitPerAuthor;
    }

    public int getExternalLimit() {
        return externalLimit;
    }

    public void setExternalLimit(int externalLimit) {
        this.externalLimit = externalLimit;
    }

    public Duration getMaxAge() {
        return maxAge;
    }

    public void setMaxAge(Duration maxAge) {
        this.maxAge = maxAge;
    }

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public void setDefaultLimit(int defaultLimit) {
        this.defaultLimit = defaultLimit;
    }

    public int getMaxLimit() {
        return maxLimit;
    }

    public void setMaxLimit(int maxLimit) {
        this.maxLimit = maxLimit;
    }
}
