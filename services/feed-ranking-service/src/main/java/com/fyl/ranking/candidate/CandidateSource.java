package com.fyl.ranking.candidate;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CandidateSource {
    IN_NETWORK("in_network"),
    OUT_OF_NETWORK("out_of_network");

    private final String value;

    CandidateSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
