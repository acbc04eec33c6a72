package dev.sidechain.service.search;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
public class InMemorySearchIndex implements SearchIndex {

    private final Map<String, PostSearchDocument> posts = new ConcurrentHashMap<>();
    private final Map<String, UserSearchDocument> users = new ConcurrentHashMap<>();

    public InMemorySearchIndex() {
        log.info("In-memory search index enabled");
    }

    @Override
    public Mono<Void> upsertPost(PostSearchDocument document) {
        return Mono.fromRunnable(() -> posts.put(document.id(), document));
    }

    @Override
    public Mono<Void> upsertUser(UserSearchDocument document) {
        return Mono.fromRunnable(() -> users.put(document.id(), document));
    }

    @Override
    public Mono<Void> deletePost(String id) {
        return Mono.fromRunnable(() -> posts.remove(id));
    }

    @Override
    public Mono<Void> deleteUser(String id) {
        return Mono.fromRunnable(() -> users.remove(id));
    }

    @Override
    public Mono<PostSearchDocument> findPost(String id) {
        return Mono.justOrEmpty(posts.get(id));
    }

    @Override
    public Mono<UserSearchDocument> findUser(String id) {
        return Mono.justOrEmpty(users.get(id));
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public boolean isHealthy() {
        return true;
    }

    public int postCount() {
        return posts.size();
    }

    public int userCount() {
        return users.size();
    }
}
