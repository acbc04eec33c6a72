package dev.sidechain.repository;

import dev.sidechain.entity.User;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface UserRepository extends ReactiveCrudRepository<User, String> {

    @Modifying
    @Query("UPDATE users SET is_online = :online, last_active_at = :lastActiveAt WHERE id = :id")
    Mono<Integer> updatePresence(String id, boolean online, LocalDateTime lastActiveAt);

    @Modifying
    @Query("UPDATE users SET show_activity_status = :showActivityStatus, show_last_active = :showLastActive, "
            + "updated_at = :updatedAt WHERE id = :id")
    Mono<Integer> updateActivityVisibility(String id, boolean showActivityStatus, boolean showLastActive,
                                           LocalDateTime updatedAt);

    @Query("SELECT * FROM users WHERE active = TRUE ORDER BY RANDOM() LIMIT :limit")
    Flux<User> findRandomSample(int limit);

    @Query("SELECT * FROM users WHERE active = FALSE AND updated_at >= :since "
            + "ORDER BY updated_at DESC LIMIT :limit")
    Flux<User> findDeactivatedSince(LocalDateTime since, int limit);
}
