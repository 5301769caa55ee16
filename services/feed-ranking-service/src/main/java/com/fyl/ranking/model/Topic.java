package com.fyl.ranking.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum Topic {
    TECH("tech"),
    POLITICS("politics"),
    CULTURE("culture"),
    MEMES("memes"),
    FINANCE("finance"),
    NEWS("news"),
    OTHER("other");

    private final String value;

    Topic(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static Topic from(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (Topic topic : values()) {
            if (topic.value.equals(normalized)) {
                return topic;
            }
        }
        return OTHER;
    }
}
