package com.fyl.ranking.feed;

public class UnknownUserException extends RuntimeException {
    private final String userId;

    public UnknownUserException(String userId) {
        super("user not found: " + userId);
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }
}
