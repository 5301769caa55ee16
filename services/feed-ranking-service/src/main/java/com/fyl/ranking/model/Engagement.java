package com.fyl.ranking.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

public record Engagement(
    @JsonProperty("user_id") String userId,
    @JsonProperty("post_id") String postId,
    @JsonProperty("engagement_type") EngagementType engagementType,
    @JsonProperty("created_at") Instant createdAt
) {}
