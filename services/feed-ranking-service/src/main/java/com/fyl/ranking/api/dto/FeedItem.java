package com.fyl.ranking.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class FeedItem {
    private PostWithAuthor post;

    @JsonProperty("ranking_explanation")
    private RankingExplanation rankingExplanation;

    /** The post being replied to, for replies. */
    @JsonProperty("parent_post")
    private PostWithAuthor parentPost;

    @JsonProperty("quoted_post")
    private PostWithAuthor quotedPost;

    public PostWithAuthor getPost() {
        return post;
    }

    public void setPost(PostWithAuthor post) {
        this.post = post;
    }

    public RankingExplanation getRankingExplanation() {
        return rankingExplanation;
    }

    public void setRankingExplanation(RankingExplanation rankingExplanation) {
        this.rankingExplanation = rankingExplanation;
    }

    public PostWithAuthor getParentPost() {
        return parentPost;
    }

    public void setParentPost(PostWithAuthor parentPost) {
        this.parentPost = parentPost;
    }

    public PostWithAuthor getQuotedPost() {
        return quotedPost;
    }

    public void setQuotedPost(PostWithAuthor quotedPost) {
        this.quotedPost = quotedPost;
    }
}
