package com.fyl.ranking.store;

import com.fyl.ranking.model.Engagement;
import com.fyl.ranking.model.EngagementType;
import com.fyl.ranking.model.Post;
import com.fyl.ranking.model.Topic;
import com.fyl.ranking.model.TopicCount;
import com.fyl.ranking.model.User;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Process-local store. Users and posts are replaced in place by id; engagements are append-only.
 * Reads never block writers, so a ranking pass may or may not observe engagements written while
 * it runs.
 */
@Component
public class InMemoryFeedStore implements ReadStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryFeedStore.class);

    private final StoreProperties properties;
    private final Clock clock;
    private final ConcurrentHashMap<String, User> users = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Post> posts = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<String>> postIdsByAuthor = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Queue<Engagement>> engagementsByPost = new ConcurrentHashMap<>();

    public InMemoryFeedStore(StoreProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public void putUser(User user) {
        users.put(user.id(), user);
    }

    public void putPost(Post post) {
        Post previous = posts.put(post.id(), post);
        if (previous != null && !previous.authorId().equals(post.authorId())) {
            log.warn("post {} changed author from {} to {}", post.id(), previous.authorId(), post.authorId());
            List<String> stale = postIdsByAuthor.get(previous.authorId());
            if (stale != null) {
                stale.remove(post.id());
            }
            previous = null;
        }
        if (previous == null) {
            postIdsByAuthor.computeIfAbsent(post.authorId(), key -> new CopyOnWriteArrayList<>()).add(post.id());
        }
    }

    public void addEngagement(Engagement engagement) {
        engagementsByPost
            .computeIfAbsent(engagement.postId(), key -> new ConcurrentLinkedQueue<>())
            .add(engagement);
    }

    @Override
    public Optional<User> getUser(String userId) {
        if (userId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(users.get(userId));
    }

    @Override
    public Map<String, User> getUsers(Collection<String> userIds) {
        Map<String, User> found = new LinkedHashMap<>();
        if (userIds == null) {
            return found;
        }
        for (String userId : userIds) {
            User user = userId == null ? null : users.get(userId);
            if (user != null) {
                found.put(userId, user);
            }
        }
        return found;
    }

    @Override
    public Optional<Post> getPost(String postId) {
        if (postId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(posts.get(postId));
    }

    @Override
    public Map<String, Post> getPosts(Collection<String> postIds) {
        Map<String, Post> found = new LinkedHashMap<>();
        if (postIds == null) {
            return found;
        }
        for (String postId : postIds) {
            Post post = postId == null ? null : posts.get(postId);
            if (post != null) {
                found.put(postId, post);
            }
        }
        return found;
    }

    @Override
    public List<String> getRecentPostIdsForFollowing(List<String> followingIds, int limitPerAuthor, Duration maxAge) {
        List<String> out = new ArrayList<>();
        if (followingIds == null || limitPerAuthor <= 0) {
            return out;
        }
        Instant cutoff = cutoff(maxAge);
        for (String authorId : followingIds) {
            List<String> authored = postIdsByAuthor.get(authorId);
            if (authored == null) {
                continue;
            }
            List<Post> recent = new ArrayList<>();
            for (String postId : authored) {
                Post post = posts.get(postId);
                if (post != null && !post.createdAt().isBefore(cutoff)) {
                    recent.add(post);
                }
            }
            recent.sort(Comparator.comparing(Post::createdAt).reversed());
            int taken = Math.min(limitPerAuthor, recent.size());
            for (int i = 0; i < taken; i++) {
                out.add(recent.get(i).id());
            }
        }
        return out;
    }

    @Override
    public List<String> getGlobalRecent(int limit, Duration maxAge) {
        if (limit <= 0) {
            return List.of();
        }
        Instant cutoff = cutoff(maxAge);
        List<Post> pool = new ArrayList<>();
        for (Post post : posts.values()) {
            if (post.isOriginal() && !post.createdAt().isBefore(cutoff)) {
                pool.add(post);
            }
        }
        pool.sort(Comparator.comparing(Post::createdAt).reversed().thenComparing(Post::id));
        List<String> out = new ArrayList<>(Math.min(limit, pool.size()));
        for (int i = 0; i < pool.size() && i < limit; i++) {
            out.add(pool.get(i).id());
        }
        return out;
    }

    @Override
    public Map<EngagementType, Integer> getEngagementCounts(String postId) {
        Map<EngagementType, Integer> counts = new EnumMap<>(EngagementType.class);
        for (EngagementType type : EngagementType.values()) {
            counts.put(type, 0);
        }
        Queue<Engagement> engagements = postId == null ? null : engagementsByPost.get(postId);
        if (engagements == null) {
            return counts;
        }
        for (Engagement engagement : engagements) {
            counts.merge(engagement.engagementType(), 1, Integer::sum);
        }
        return counts;
    }

    @Override
    public List<TopicCount> getTopicCounts(Duration maxAge, int limit) {
        Instant cutoff = cutoff(maxAge);
        Map<Topic, Integer> counts = new EnumMap<>(Topic.class);
        for (Post post : posts.values()) {
            if (post.createdAt().isBefore(cutoff)) {
                continue;
            }
            for (Topic topic : post.topics()) {
                counts.merge(topic, 1, Integer::sum);
            }
        }
        List<TopicCount> sorted = new ArrayList<>();
        for (Map.Entry<Topic, Integer> entry : counts.entrySet()) {
            sorted.add(new TopicCount(entry.getKey(), entry.getValue()));
        }
        sorted.sort(Comparator.comparingInt(TopicCount::count).reversed());
        return sorted.size() > limit ? new ArrayList<>(sorted.subList(0, Math.max(limit, 0))) : sorted;
    }

    @Override
    public List<Post> getPostsByAuthor(String authorId, int limit) {
        List<String> authored = authorId == null ? null : postIdsByAuthor.get(authorId);
        if (authored == null || limit <= 0) {
            return List.of();
        }
        List<Post> out = new ArrayList<>();
        for (String postId : authored) {
            Post post = posts.get(postId);
            if (post != null) {
                out.add(post);
            }
        }
        out.sort(Comparator.comparing(Post::createdAt).reversed());
        return out.size() > limit ? new ArrayList<>(out.subList(0, limit)) : out;
    }

    private Instant cutoff(Duration maxAge) {
        Duration window = maxAge == null ? properties.getRetention() : maxAge;
        return clock.instant().minus(window);
    }
}
