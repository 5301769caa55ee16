package com.fyl.ranking.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PersonaKind {
    FOUNDER("founder"),
    JOURNALIST("journalist"),
    MEME("meme"),
    TRADER("trader"),
    POLITICIAN("politician"),
    CULTURE("culture"),
    TECH("tech");

    private final String value;

    PersonaKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
