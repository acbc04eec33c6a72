package dev.sidechain.service.search;

import dev.sidechain.config.ResilienceConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Selects the search backend with {@code sidechain.search.type} ({@code memory} or {@code elasticsearch}).
 */
@Configuration(proxyBeanMethods = false)
public class SearchIndexConfig {

    @Bean
    @ConditionalOnProperty(name = "sidechain.search.type", havingValue = "memory", matchIfMissing = true)
    public SearchIndex inMemorySearchIndex() {
        return new InMemorySearchIndex();
    }

    @Bean
    @ConditionalOnProperty(name = "sidechain.search.type", havingValue = "elasticsearch")
    public SearchIndex elasticsearchSearchIndex(
            WebClient.Builder webClientBuilder,
            ResilienceConfig resilience,
            @Value("${sidechain.search.elasticsearch.url:http://localhost:9200}") String url,
            @Value("${sidechain.search.elasticsearch.username:}") String username,
            @Value("${sidechain.search.elasticsearch.password:}") String password) {
        return new ElasticsearchSearchIndex(webClientBuilder, url, username, password, resilience);
    }
}
