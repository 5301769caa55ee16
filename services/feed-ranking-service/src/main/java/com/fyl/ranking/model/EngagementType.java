package com.fyl.ranking.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EngagementType {
    LIKE("like"),
    REPOST("repost"),
    REPLY("reply"),
    QUOTE("quote"),
    PROFILE_CLICK("profile_click"),
    NOT_INTERESTED("not_interested");

    private final String value;

    EngagementType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
