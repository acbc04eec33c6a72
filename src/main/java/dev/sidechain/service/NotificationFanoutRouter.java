package dev.sidechain.service;

import dev.sidechain.config.ResilienceConfig;
import dev.sidechain.metrics.RealtimeMetrics;
import dev.sidechain.repository.RelationshipRepository;
import dev.sidechain.service.feed.FeedStore;
import dev.sidechain.service.feed.NotificationEvent;
import dev.sidechain.websocket.ConnectionRegistry;
import dev.sidechain.websocket.message.DomainEvent;
import dev.sidechain.websocket.message.Envelope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Delivers a domain event to its recipients: live push when they are connected here, the
 * durable feed when they are not and the event kind is durable.
 * <p>
 * Each recipient is processed independently. A failure for one is counted as
 * {@link FanoutOutcome#FAILED} and never stops the others.
 * </p>
 */
@Service
@Slf4j
public class NotificationFanoutRouter {

    static final int PREVIEW_MAX = 100;

    private final ConnectionRegistry registry;
    private final RelationshipRepository relationships;
    private final NotificationPreferenceService preferences;
    private final FeedStore feedStore;
    private final IdService idService;
    private final RealtimeMetrics metrics;
    private final ResilienceConfig resilience;
    private final int concurrency;

    public NotificationFanoutRouter(
            ConnectionRegistry registry,
            RelationshipRepository relationships,
            NotificationPreferenceService preferences,
            FeedStore feedStore,
            IdService idService,
            RealtimeMetrics metrics,
            ResilienceConfig resilience,
            @Value("${fanout.concurrency:32}") int concurrency) {
        this.registry = registry;
        this.relationships = relationships;
        this.preferences = preferences;
        this.feedStore = feedStore;
        this.idService = idService;
        this.metrics = metrics;
        this.resilience = resilience;
        this.concurrency = concurrency;
    }

    public Mono<FanoutReport> dispatch(DomainEvent event, Collection<String> recipientIds) {
        String eventId = idService.nextEventId();
        Instant time = Instant.now();
        Envelope envelope = Envelope.withId(event.messageType(), event, eventId);

        Set<String> recipients = new LinkedHashSet<>();
        for (String id : recipientIds) {
            if (id != null && !id.isBlank() && !id.equals(event.actorId())) {
                recipients.add(id);
            }
        }

        return Flux.fromIterable(recipients)
                .flatMap(recipient -> deliverTo(recipient, event, eventId, time, envelope), concurrency)
                .collectList()
                .map(results -> FanoutReport.of(eventId, event.messageType(), results))
                .doOnNext(report -> log.info("Dispatched {} {} from {} to {} recipient(s): {}",
                        event.messageType(), eventId, event.actorId(), report.recipients(), report.outcomes()));
    }

    private Mono<FanoutOutcome> deliverTo(String recipient, DomainEvent event, String eventId, Instant time,
                                          Envelope envelope) {
        return isSuppressed(recipient, event.actorId())
                .flatMap(suppressed -> {
                    if (suppressed) {
                        return Mono.just(FanoutOutcome.SUPPRESSED_RELATIONSHIP);
                    }
                    return preferences.isEnabled(recipient, event.category().orElse(null))
                            .flatMap(enabled -> enabled
                                    ? pushOrQueue(recipient, event, eventId, time, envelope)
                                    : Mono.just(FanoutOutcome.SUPPRESSED_PREFERENCE));
                })
                .onErrorResume(e -> {
                    log.warn("Delivery of {} {} to {} failed: {}", event.messageType(), eventId, recipient, e.getMessage());
                    return Mono.just(FanoutOutcome.FAILED);
                })
                .doOnNext(outcome -> metrics.fanoutOutcome(outcome.metricTag()));
    }

    /**
     * A failed lookup suppresses; a block must never leak through an outage.
     */
    private Mono<Boolean> isSuppressed(String recipient, String actorId) {
        if (actorId == null) {
            return Mono.just(false);
        }
        return relationships.isSuppressed(recipient, actorId)
                .timeout(resilience.getDatabaseTimeout())
                .defaultIfEmpty(false)
                .onErrorResume(e -> {
                    log.warn("Mute/block lookup {} -> {} failed, suppressing: {}", recipient, actorId, e.getMessage());
                    return Mono.just(true);
                });
    }

    private Mono<FanoutOutcome> pushOrQueue(String recipient, DomainEvent event, String eventId, Instant time,
                                            Envelope envelope) {
        int delivered = registry.send(recipient, envelope);
        if (delivered > 0) {
            return Mono.just(FanoutOutcome.DELIVERED);
        }
        if (!event.durable()) {
            return Mono.just(FanoutOutcome.SKIPPED_OFFLINE);
        }
        NotificationEvent activity = new NotificationEvent(eventId, recipient, event.actorId(), event.actorName(),
                event.verb(), event.objectId(), truncate(event.preview()), time, false, false);
        return feedStore.add(activity).thenReturn(FanoutOutcome.QUEUED);
    }

    private static String truncate(String text) {
        if (text == null) {
            return null;
        }
        return text.length() > PREVIEW_MAX ? text.substring(0, PREVIEW_MAX) : text;
    }
}
