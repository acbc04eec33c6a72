package dev.sidechain.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import dev.sidechain.config.ResilienceConfig;
import dev.sidechain.entity.NotificationCategory;
import dev.sidechain.entity.NotificationPreference;
import dev.sidechain.exception.PreferenceLookupException;
import dev.sidechain.repository.NotificationPreferenceRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The notification preference gate: per-user, per-category switches consulted for every
 * recipient of every fan-out.
 * <p>
 * Reads are served from a Caffeine cache. A missing row means all categories are enabled,
 * and a failed lookup also answers enabled (a dropped notification is worse than an
 * unwanted one). Categories that have no switch are always enabled.
 * </p>
 */
@Service
@Slf4j
public class NotificationPreferenceService {

    private final NotificationPreferenceRepository repository;
    private final ResilienceConfig resilience;
    private final Cache<String, NotificationPreference> cache;

    public NotificationPreferenceService(
            NotificationPreferenceRepository repository,
            ResilienceConfig resilience,
            @Value("${notifications.preferences.cache-max-size:50000}") long cacheMaxSize,
            @Value("${notifications.preferences.cache-ttl-minutes:5}") long cacheTtlMinutes) {
        this.repository = repository;
        this.resilience = resilience;
        this.cache = Caffeine.newBuilder()
                .maximumSize(cacheMaxSize)
                .expireAfterWrite(Duration.ofMinutes(cacheTtlMinutes))
                .build();
    }

    /**
     * @param category {@code null} for event kinds without a switch
     */
    public Mono<Boolean> isEnabled(String userId, NotificationCategory category) {
        if (category == null) {
            return Mono.just(true);
        }
        return load(userId)
                .map(category::isEnabledIn)
                .onErrorResume(e -> {
                    log.warn("{}; delivering '{}' anyway", e.getMessage(), category.key());
                    return Mono.just(true);
                });
    }

    /**
     * Lookup by wire key. Keys that are not a known category are enabled.
     */
    public Mono<Boolean> isEnabled(String userId, String categoryKey) {
        return isEnabled(userId, NotificationCategory.fromKey(categoryKey).orElse(null));
    }

    public Mono<Map<String, Boolean>> getPreferences(String userId) {
        return load(userId).map(NotificationPreferenceService::toMap);
    }

    /**
     * Merges {@code updates} into the stored row, creating it on first write.
     *
     * @throws IllegalArgumentException for an unknown category or a null value
     */
    public Mono<Map<String, Boolean>> setPreferences(String userId, Map<String, Boolean> updates) {
        Map<NotificationCategory, Boolean> parsed = new EnumMap<>(NotificationCategory.class);
        for (Map.Entry<String, Boolean> entry : updates.entrySet()) {
            NotificationCategory category = NotificationCategory.fromKey(entry.getKey())
                    .orElseThrow(() -> new IllegalArgumentException(
                            "Unknown notification category: " + entry.getKey()));
            if (entry.getValue() == null) {
                throw new IllegalArgumentException("Preference '" + entry.getKey() + "' must be true or false");
            }
            parsed.put(category, entry.getValue());
        }

        return Mono.defer(() -> repository.findById(userId)
                        .defaultIfEmpty(NotificationPreference.defaultsFor(userId))
                        .flatMap(preference -> {
                            parsed.forEach((category, enabled) -> category.applyTo(preference, enabled));
                            LocalDateTime now = LocalDateTime.now(ZoneOffset.UTC);
                            if (preference.isNew()) {
                                preference.setCreatedAt(now);
                            }
                            preference.setUpdatedAt(now);
                            return repository.save(preference);
                        }))
                // two first writes for the same user race on the insert; the loser retries as an update
                .retryWhen(Retry.max(1).filter(DataIntegrityViolationException.class::isInstance))
                .timeout(resilience.getDatabaseTimeout())
                .doOnNext(saved -> {
                    saved.setNewRecord(false);
                    cache.put(userId, saved);
                    log.info("Notification preferences updated for {}: {}", userId, parsed.keySet());
                })
                .map(NotificationPreferenceService::toMap);
    }

    private Mono<NotificationPreference> load(String userId) {
        NotificationPreference cached = cache.getIfPresent(userId);
        if (cached != null) {
            return Mono.just(cached);
        }
        return repository.findById(userId)
                .timeout(resilience.getDatabaseTimeout())
                .retryWhen(resilience.databaseRetry())
                .defaultIfEmpty(NotificationPreference.defaultsFor(userId))
                .doOnNext(preference -> cache.put(userId, preference))
                .onErrorMap(e -> !(e instanceof PreferenceLookupException),
                        e -> new PreferenceLookupException(userId, e));
    }

    private static Map<String, Boolean> toMap(NotificationPreference preference) {
        Map<String, Boolean> map = new LinkedHashMap<>();
        for (NotificationCategory category : NotificationCategory.values()) {
            map.put(category.key(), category.isEnabledIn(preference));
        }
        return map;
    }
}
