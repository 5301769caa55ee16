package com.fyl.ranking.external;

import com.fyl.ranking.candidate.Candidate;
import com.fyl.ranking.candidate.CandidateFeatures;
import com.fyl.ranking.candidate.CandidateSource;
import com.fyl.ranking.model.EngagementType;
import com.fyl.ranking.model.Post;
import com.fyl.ranking.model.PostType;
import com.fyl.ranking.model.Topic;
import com.fyl.ranking.model.User;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Top headlines from NewsAPI.org as synthetic original posts by the {@code news_api} author.
 */
@Component
public class NewsApiContentSource implements ExternalContentSource {
    private static final Logger log = LoggerFactory.getLogger(NewsApiContentSource.class);
    public static final String AUTHOR_ID = "news_api";
    public static final String PROVIDER = "newsapi";
    private static final int MAX_PAGE_SIZE = 100;

    private static final Map<String, Topic> CATEGORY_TOPICS = Map.of(
        "business", Topic.FINANCE,
        "entertainment", Topic.CULTURE,
        "general", Topic.NEWS,
        "health", Topic.OTHER,
        "science", Topic.TECH,
        "sports", Topic.CULTURE,
        "technology", Topic.TECH
    );

    private final RestTemplate restTemplate;
    private final NewsApiProperties properties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public NewsApiContentSource(
        @Qualifier("newsApiRestTemplate") RestTemplate restTemplate,
        NewsApiProperties properties,
        Clock clock,
        MeterRegistry meterRegistry
    ) {
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public String name() {
        return PROVIDER;
    }

    @Override
    public boolean isAvailable() {
        return properties.isEnabled() && properties.getApiKey() != null && !properties.getApiKey().isBlank();
    }

    @Override
    public List<Candidate> fetch(int limit) {
        if (!isAvailable() || limit <= 0) {
            return List.of();
        }
        meterRegistry.counter("feed_external_fetch_total", "source", PROVIDER).increment();
        try {
            NewsApiResponse response = topHeadlines(limit);
            return toCandidates(response, limit);
        } catch (NewsApiUnavailableException ex) {
            meterRegistry.counter("feed_external_fetch_failed_total", "source", PROVIDER).increment();
            log.debug("news api unavailable; contributing no candidates", ex);
            return List.of();
        } catch (RuntimeException ex) {
            meterRegistry.counter("feed_external_fetch_failed_total", "source", PROVIDER).increment();
            log.warn("news api payload could not be mapped; contributing no candidates", ex);
            return List.of();
        }
    }

    private NewsApiResponse topHeadlines(int limit) {
        String category = normalizedCategory();
        String country = properties.getCountry() == null ? "" : properties.getCountry().trim().toLowerCase(Locale.ROOT);

        UriComponentsBuilder uri = UriComponentsBuilder.fromHttpUrl(trimTrailingSlash(properties.getBaseUrl()))
            .path("/v2/top-headlines")
            .queryParam("pageSize", Math.min(limit, MAX_PAGE_SIZE));
        if (country.length() == 2) {
            uri.queryParam("country", country);
        }
        if (CATEGORY_TOPICS.containsKey(category)) {
            uri.queryParam("category", category);
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.add("X-Api-Key", properties.getApiKey());

        try {
            ResponseEntity<NewsApiResponse> response = restTemplate.exchange(
                uri.build().toUri(),
                HttpMethod.GET,
                new HttpEntity<>(headers),
                NewsApiResponse.class
            );
            NewsApiResponse body = response.getBody();
            if (body == null) {
                throw new NewsApiUnavailableException("news api returned empty body");
            }
            return body;
        } catch (ResourceAccessException e) {
            throw new NewsApiUnavailableException("news api unreachable", e);
        } catch (HttpStatusCodeException e) {
            throw new NewsApiUnavailableException("news api error: " + e.getStatusCode(), e);
        } catch (RestClientException e) {
            throw new NewsApiUnavailableException("news api response unreadable", e);
        }
    }

    private List<Candidate> toCandidates(NewsApiResponse response, int limit) {
        List<NewsApiResponse.Article> articles = response.getArticles() == null ? List.of() : response.getArticles();
        Instant now = clock.instant();
        String fallbackCategory = normalizedCategory();
        List<Candidate> out = new ArrayList<>();
        for (int i = 0; i < articles.size() && i < limit; i++) {
            NewsApiResponse.Article article = articles.get(i);
            if (article == null || article.getTitle() == null || article.getTitle().isBlank()) {
                continue;
            }
            String title = article.getTitle().trim();
            String description = article.getDescription() == null ? "" : article.getDescription().trim();
            String text = TextSanitizer.sanitize(
                description.isEmpty() ? title : title + " " + description,
                properties.getMaxTextLength()
            );
            String category = article.getCategory() == null || article.getCategory().isBlank()
                ? fallbackCategory
                : article.getCategory().trim().toLowerCase(Locale.ROOT);
            Topic topic = CATEGORY_TOPICS.getOrDefault(category, Topic.NEWS);
            Instant createdAt = parsePublishedAt(article.getPublishedAt(), now.minus(Duration.ofMinutes(i)));
            String sourceName = article.getSource() == null || article.getSource().getName() == null
                ? "News"
                : article.getSource().getName();

            Post post = new Post(
                "news_" + createdAt.getEpochSecond() + "_" + i,
                AUTHOR_ID,
                text,
                PostType.ORIGINAL,
                null,
                null,
                List.of(topic),
                createdAt,
                0,
                0,
                0,
                0,
                0
            );
            User author = new User(
                AUTHOR_ID,
                AUTHOR_ID,
                sourceName,
                "Headlines from News API",
                null,
                List.of(topic),
                null,
                List.of(),
                0,
                0
            );
            out.add(new Candidate(post, author, CandidateSource.OUT_OF_NETWORK, zeroCounts(), CandidateFeatures.of(PROVIDER)));
        }
        return out;
    }

    private String normalizedCategory() {
        return properties.getCategory() == null ? "general" : properties.getCategory().trim().toLowerCase(Locale.ROOT);
    }

    private static Instant parsePublishedAt(String raw, Instant fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return OffsetDateTime.parse(raw.trim()).toInstant();
        } catch (DateTimeParseException ex) {
            return fallback;
        }
    }

    private static Map<EngagementType, Integer> zeroCounts() {
        Map<EngagementType, Integer> counts = new EnumMap<>(EngagementType.class);
        for (EngagementType type : EngagementType.values()) {
            counts.put(type, 0);
        }
        return counts;
    }

    private static String trimTrailingSlash(String base) {
        if (base != null && base.endsWith("/")) {
            return base.substring(0, base.length() - 1);
        }
        return base;
    }
}
