package dev.sidechain.repository;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Read access to the social graph tables ({@code follows}, {@code user_mutes},
 * {@code user_blocks}). Writes belong to the follow/mute/block handlers elsewhere.
 */
public interface RelationshipRepository {

    /** Users who follow {@code userId}, capped at {@code limit}. */
    Flux<String> findFollowerIds(String userId, int limit);

    /** Users {@code userId} follows, capped at {@code limit}. */
    Flux<String> findFollowingIds(String userId, int limit);

    /** True when {@code recipientId} muted or blocked {@code actorId}, or {@code actorId} blocked the recipient. */
    Mono<Boolean> isSuppressed(String recipientId, String actorId);
}
