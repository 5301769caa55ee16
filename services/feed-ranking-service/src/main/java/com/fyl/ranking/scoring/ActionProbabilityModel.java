package com.fyl.ranking.scoring;

import com.fyl.ranking.api.dto.AlgorithmPreferences;
import com.fyl.ranking.candidate.Candidate;
import java.time.Instant;
import java.util.Map;

/**
 * Predicts, per candidate, how likely the viewer is to take each {@link ActionType}. The scorer
 * only consumes the returned map, so a learned model can replace the heuristic without touching
 * the pipeline. Missing actions are treated as probability 0.
 */
public interface ActionProbabilityModel {
    String modelId();

    Map<ActionType, Double> predict(Candidate candidate, AlgorithmPreferences preferences, Instant now);
}
