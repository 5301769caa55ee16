package com.fyl.ranking.scoring;

import com.fyl.ranking.api.dto.AlgorithmPreferences;
import com.fyl.ranking.candidate.Candidate;
import com.fyl.ranking.model.EngagementType;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Deterministic stand-in for a learned action model: every probability is a function of the
 * candidate's age and engagement counts.
 */
@Component
public class HeuristicActionProbabilityModel implements ActionProbabilityModel {
    private static final double SECONDS_PER_HOUR = 3600.0;

    @Override
    public String modelId() {
        return "heuristic_actions_v1";
    }

    @Override
    public Map<ActionType, Double> predict(Candidate candidate, AlgorithmPreferences preferences, Instant now) {
        int likes = candidate.engagementCount(EngagementType.LIKE);
        int reposts = candidate.engagementCount(EngagementType.REPOST);
        int replies = candidate.engagementCount(EngagementType.REPLY);

        double recency = recencyScore(candidate.getPost().createdAt(), now);
        double popularity = popularityScore(likes, reposts, replies);
        double rv = preferences.getRecencyVsPopularity();
        double base = (1.0 - rv) * recency + rv * popularity;

        Map<ActionType, Double> out = new EnumMap<>(ActionType.class);
        out.put(ActionType.LIKE, base * (0.4 + 0.3 * Math.min(1.0, likes / 20.0)));
        out.put(ActionType.REPOST, base * (0.2 + 0.2 * Math.min(1.0, reposts / 10.0)));
        out.put(ActionType.REPLY, base * 0.25);
        out.put(ActionType.QUOTE, base * 0.15);
        out.put(ActionType.CLICK, base * 0.5);
        out.put(ActionType.SHARE, base * 0.2);
        out.put(ActionType.FOLLOW_AUTHOR, base * 0.1);

        double negative = preferences.getNegativeSignalStrength();
        out.put(ActionType.NOT_INTERESTED, 0.05 * negative);
        out.put(ActionType.BLOCK_AUTHOR, 0.02 * negative);
        out.put(ActionType.MUTE_AUTHOR, 0.03 * negative);
        out.put(ActionType.REPORT, 0.01 * negative);
        return out;
    }

    /**
     * Hyperbolic decay over hours; posts from the future count as brand new.
     */
    public static double recencyScore(Instant createdAt, Instant now) {
        double ageSeconds = Math.max(0.0, Duration.between(createdAt, now).toMillis() / 1000.0);
        return 1.0 / (1.0 + ageSeconds / SECONDS_PER_HOUR);
    }

    static double popularityScore(int likes, int reposts, int replies) {
        double weighted = likes * 1.0 + reposts * 2.0 + replies * 1.5;
        return Math.min(1.0, Math.tanh(weighted / 10.0) * 0.5 + 0.5);
    }
}
