package com.fyl.ranking.external;

public class NewsApiUnavailableException extends RuntimeException {
    public NewsApiUnavailableException(String message) {
        super(message);
    }

    public NewsApiUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
