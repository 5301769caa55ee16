package com.fyl.ranking.mixer;

import com.fyl.ranking.api.dto.FeedItem;
import com.fyl.ranking.api.dto.PostWithAuthor;
import com.fyl.ranking.candidate.Candidate;
import com.fyl.ranking.candidate.ScoredCandidate;
import com.fyl.ranking.model.EngagementType;
import com.fyl.ranking.model.Post;
import com.fyl.ranking.model.User;
import com.fyl.ranking.store.ReadStore;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Resolves display context for selected items: author, live engagement counts and, one level
 * deep, the parent or quoted post with its author. Missing references are left {@code null}.
 */
@Component
public class FeedHydrator {
    private final ReadStore store;

    public FeedHydrator(ReadStore store) {
        this.store = store;
    }

    public FeedItem hydrate(ScoredCandidate scored, boolean includeExplanation) {
        Candidate candidate = scored.candidate();
        Post post = candidate.getPost();
        User author = store.getUser(post.authorId()).orElse(candidate.getAuthor());

        PostWithAuthor view = PostWithAuthor.from(post, author);
        Map<EngagementType, Integer> counts = liveCounts(candidate);
        view.setLikeCount(counts.getOrDefault(EngagementType.LIKE, 0));
        view.setRepostCount(counts.getOrDefault(EngagementType.REPOST, 0));
        view.setReplyCount(counts.getOrDefault(EngagementType.REPLY, 0));
        view.setQuoteCount(counts.getOrDefault(EngagementType.QUOTE, 0));

        FeedItem item = new FeedItem();
        item.setPost(view);
        item.setRankingExplanation(includeExplanation ? scored.explanation() : null);
        item.setParentPost(referenced(post.parentId()));
        item.setQuotedPost(referenced(post.quotedId()));
        return item;
    }

    private Map<EngagementType, Integer> liveCounts(Candidate candidate) {
        if (store.getPost(candidate.getPostId()).isEmpty()) {
            // not stored (external content): keep what the source supplied
            return candidate.getEngagementCounts();
        }
        return store.getEngagementCounts(candidate.getPostId());
    }

    private PostWithAuthor referenced(String postId) {
        if (postId == null) {
            return null;
        }
        Optional<Post> referenced = store.getPost(postId);
        if (referenced.isEmpty()) {
            return null;
        }
        Post post = referenced.get();
        return PostWithAuthor.from(post, store.getUser(post.authorId()).orElse(null));
    }
}
