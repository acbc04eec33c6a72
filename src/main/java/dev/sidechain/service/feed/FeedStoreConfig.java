package dev.sidechain.service.feed;

import dev.sidechain.config.ResilienceConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Selects the notification feed backend with {@code sidechain.feed.type} ({@code memory} or {@code stream}).
 */
@Configuration(proxyBeanMethods = false)
public class FeedStoreConfig {

    @Bean
    @ConditionalOnProperty(name = "sidechain.feed.type", havingValue = "memory", matchIfMissing = true)
    public FeedStore inMemoryFeedStore(@Value("${sidechain.feed.max-per-user:500}") int maxPerUser) {
        return new InMemoryFeedStore(maxPerUser);
    }

    @Bean
    @ConditionalOnProperty(name = "sidechain.feed.type", havingValue = "stream")
    public FeedStore streamFeedStore(
            WebClient.Builder webClientBuilder,
            ResilienceConfig resilience,
            @Value("${sidechain.feed.stream.base-url:https://api.stream-io-api.com/api/v1.0}") String baseUrl,
            @Value("${sidechain.feed.stream.api-key:}") String apiKey,
            @Value("${sidechain.feed.stream.api-secret:}") String apiSecret,
            @Value("${sidechain.feed.stream.feed-group:notification}") String feedGroup) {
        return new StreamFeedStore(webClientBuilder, baseUrl, apiKey, apiSecret, feedGroup, resilience);
    }
}
