package com.fyl.ranking.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fyl.ranking.model.Post;
import com.fyl.ranking.model.PostType;
import com.fyl.ranking.model.Topic;
import com.fyl.ranking.model.User;
import java.time.Instant;
import java.util.List;

public class PostWithAuthor {
    private String id;

    @JsonProperty("author_id")
    private String authorId;

    private String text;

    @JsonProperty("post_type")
    private PostType postType;

    @JsonProperty("parent_id")
    private String parentId;

    @JsonProperty("quoted_id")
    private String quotedId;

    private List<Topic> topics;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("like_count")
    private int likeCount;

    @JsonProperty("repost_count")
    private int repostCount;

    @JsonProperty("reply_count")
    private int replyCount;

    @JsonProperty("quote_count")
    private int quoteCount;

    @JsonProperty("view_count")
    private int viewCount;

    private User author;

    public static PostWithAuthor from(Post post, User author) {
        PostWithAuthor view = new PostWithAuthor();
        view.id = post.id();
        view.authorId = post.authorId();
        view.text = post.text();
        view.postType = post.postType();
        view.parentId = post.parentId();
        view.quotedId = post.quotedId();
        view.topics = post.topics();
        view.createdAt = post.createdAt();
        view.likeCount = post.likeCount();
        view.repostCount = post.repostCount();
        view.replyCount = post.replyCount();
        view.quoteCount = post.quoteCount();
        view.viewCount = post.viewCount();
        view.author = author;
        return view;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getAuthorId() {
        return authorId;
    }

    public void setAuthorId(String authorId) {
        this.authorId = authorId;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public PostType getPostType() {
        return postType;
    }

    public void setPostType(PostType postType) {
        this.postType = postType;
    }

    public String getParentId() {
        return parentId;
    }

    public void setParentId(String parentId) {
        this.parentId = parentId;
    }

    public String getQuotedId() {
        return quotedId;
    }

    public void setQuotedId(String quotedId) {
        this.quotedId = quotedId;
    }

    public List<Topic> getTopics() {
        return topics;
    }

    public void setTopics(List<Topic> topics) {
        this.topics = topics;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public int getLikeCount() {
        return likeCount;
    }

    public void setLikeCount(int likeCount) {
        this.likeCount = likeCount;
    }

    public int getRepostCount() {
        return repostCount;
    }

    public void setRepostCount(int repostCount) {
        this.repostCount = repostCount;
    }

    public int getReplyCount() {
        return replyCount;
    }

    public void setReplyCount(int replyCount) {
        this.replyCount = replyCount;
    }

    public int getQuoteCount() {
        return quoteCount;
    }

    public void setQuoteCount(int quoteCount) {
        this.quoteCount = quoteCount;
    }

    public int getViewCount() {
        return viewCount;
    }

    public void setViewCount(int viewCount) {
        this.viewCount = viewCount;
    }

    public User getAuthor() {
        return author;
    }

    public void setAuthor(User author) {
        this.author = author;
    }
}
