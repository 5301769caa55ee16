package com.fyl.ranking.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;

public class FeedResponse {
    private List<FeedItem> items = new ArrayList<>();

    /** Always null: feeds are served as a single page. */
    @JsonProperty("next_cursor")
    private String nextCursor;

    public static FeedResponse empty() {
        return new FeedResponse();
    }

    public List<FeedItem> getItems() {
        return items;
    }

    public void setItems(List<FeedItem> items) {
        this.items = items;
    }

    public String getNextCursor() {
        return nextCursor;
    }

    public void setNextCursor(String nextCursor) {
        this.nextCursor = nextCursor;
    }
}
