package com.fyl.ranking.store;

import com.fyl.ranking.model.EngagementType;
import com.fyl.ranking.model.Post;
import com.fyl.ranking.model.TopicCount;
import com.fyl.ranking.model.User;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Indexed read access to users, posts and engagements.
 *
 * <p>A {@code null} max age means the store's own retention window. Bulk lookups silently drop
 * ids they cannot resolve.
 */
public interface ReadStore {
    Optional<User> getUser(String userId);

    Map<String, User> getUsers(Collection<String> userIds);

    Optional<Post> getPost(String postId);

    /**
     * Resolves the given ids, preserving request order in the returned map.
     */
    Map<String, Post> getPosts(Collection<String> postIds);

    /**
     * Most recent first per author, flattened in the order of {@code followingIds}.
     */
    List<String> getRecentPostIdsForFollowing(List<String> followingIds, int limitPerAuthor, Duration maxAge);

    /**
     * Ids of original posts only, strictly newest first.
     */
    List<String> getGlobalRecent(int limit, Duration maxAge);

    /**
     * Counts for every {@link EngagementType}, zero when absent.
     */
    Map<EngagementType, Integer> getEngagementCounts(String postId);

    List<TopicCount> getTopicCounts(Duration maxAge, int limit);

    List<Post> getPostsByAuthor(String authorId, int limit);
}
