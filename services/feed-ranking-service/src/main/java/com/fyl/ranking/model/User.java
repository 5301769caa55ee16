package com.fyl.ranking.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Objects;

public record User(
    String id,
    String handle,
    @JsonProperty("display_name") String displayName,
    String bio,
    @JsonProperty("persona_kind") PersonaKind personaKind,
    List<Topic> topics,
    @JsonProperty("avatar_url") String avatarUrl,
    @JsonProperty("following_ids") List<String> followingIds,
    @JsonProperty("followers_count") int followersCount,
    @JsonProperty("following_count") int followingCount
) {
    public User {
        bio = bio == null ? "" : bio;
        topics = topics == null ? List.of() : topics.stream().filter(Objects::nonNull).toList();
        followingIds = followingIds == null ? List.of() : List.copyOf(followingIds);
    }

    public static User of(String id, String handle, List<String> followingIds) {
        return new User(id, handle, handle, "", null, List.of(), null, followingIds, 0, followingIds == null ? 0 : followingIds.size());
    }
}
