package dev.sidechain.service.search;

import reactor.core.publisher.Mono;

/**
 * Secondary search index over posts and users. Upserts are idempotent.
 * Failures surface as {@link dev.sidechain.exception.ExternalServiceException}.
 */
public interface SearchIndex {

    String POSTS = "posts";
    String USERS = "users";

    Mono<Void> upsertPost(PostSearchDocument document);

    Mono<Void> upsertUser(UserSearchDocument document);

    Mono<Void> deletePost(String id);

    Mono<Void> deleteUser(String id);

    Mono<PostSearchDocument> findPost(String id);

    Mono<UserSearchDocument> findUser(String id);

    String name();

    boolean isHealthy();
}
