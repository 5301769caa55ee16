package com.fyl.ranking;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FeedRankingApplication {
    public static void main(String[] args) {
        SpringApplication.run(FeedRankingApplication.class, args);
    }
}
