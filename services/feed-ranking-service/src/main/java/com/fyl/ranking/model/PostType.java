package com.fyl.ranking.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PostType {
    ORIGINAL("original"),
    REPLY("reply"),
    REPOST("repost"),
    QUOTE("quote");

    private final String value;

    PostType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
