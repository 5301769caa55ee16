package com.fyl.ranking.candidate;

import com.fyl.ranking.api.dto.RankingExplanation;

public record ScoredCandidate(Candidate candidate, double finalScore, RankingExplanation explanation) {
    public ScoredCandidate {
        if (!candidate.getPostId().equals(explanation.getPostId())) {
            throw new IllegalArgumentException(
                "explanation " + explanation.getPostId() + " does not belong to post " + candidate.getPostId()
            );
        }
    }

    public String postId() {
        return candidate.getPostId();
    }

    public String authorId() {
        return candidate.getAuthorId();
    }
}
