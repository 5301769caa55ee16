package com.fyl.ranking.external;

import java.time.Duration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestTemplate;

/**
 * Client for the headlines endpoint. NewsAPI rejects requests without a user agent; the api key
 * is added per request so a blank key never reaches the wire.
 */
@Configuration
@EnableConfigurationProperties(NewsApiProperties.class)
public class NewsApiConfig {
    static final String USER_AGENT = "fyl-feed-ranking/0.1";

    @Bean
    public RestTemplate newsApiRestTemplate(RestTemplateBuilder builder, NewsApiProperties properties) {
        // 0 means no timeout to the underlying client
        Duration timeout = Duration.ofMillis(Math.max(properties.getTimeoutMs(), 1));
        return builder
            .setConnectTimeout(timeout)
            .setReadTimeout(timeout)
            .defaultHeader(HttpHeaders.USER_AGENT, USER_AGENT)
            .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
            .build();
    }
}
