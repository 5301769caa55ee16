package com.fyl.ranking.model;

public record TopicCount(Topic topic, int count) {}
