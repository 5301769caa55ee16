package com.fyl.ranking.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A stored post. The counters are denormalized snapshots and may lag behind the engagement log;
 * ranking and hydration read live counts from the store instead.
 */
public record Post(
    String id,
    @JsonProperty("author_id") String authorId,
    String text,
    @JsonProperty("post_type") PostType postType,
    @JsonProperty("parent_id") String parentId,
    @JsonProperty("quoted_id") String quotedId,
    List<Topic> topics,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("like_count") int likeCount,
    @JsonProperty("repost_count") int repostCount,
    @JsonProperty("reply_count") int replyCount,
    @JsonProperty("quote_count") int quoteCount,
    @JsonProperty("view_count") int viewCount
) {
    public Post {
        postType = postType == null ? PostType.ORIGINAL : postType;
        topics = topics == null ? List.of() : topics.stream().filter(Objects::nonNull).toList();
    }

    public static Post original(String id, String authorId, String text, List<Topic> topics, Instant createdAt) {
        return new Post(id, authorId, text, PostType.ORIGINAL, null, null, topics, createdAt, 0, 0, 0, 0, 0);
    }

    public static Post reply(String id, String authorId, String text, String parentId, Instant createdAt) {
        return new Post(id, authorId, text, PostType.REPLY, parentId, null, List.of(), createdAt, 0, 0, 0, 0, 0);
    }

    public static Post quote(String id, String authorId, String text, String quotedId, Instant createdAt) {
        return new Post(id, authorId, text, PostType.QUOTE, null, quotedId, List.of(), createdAt, 0, 0, 0, 0, 0);
    }

    @JsonIgnore
    public boolean isOriginal() {
        return postType == PostType.ORIGINAL;
    }
}
