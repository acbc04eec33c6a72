package dev.sidechain.repository;

import dev.sidechain.entity.Post;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.time.LocalDateTime;

@Repository
public interface PostRepository extends ReactiveCrudRepository<Post, String> {

    @Query("SELECT p.*, u.username FROM posts p JOIN users u ON u.id = p.user_id "
            + "WHERE p.deleted_at IS NULL ORDER BY RANDOM() LIMIT :limit")
    Flux<Post> findRandomSample(int limit);

    @Query("SELECT * FROM posts WHERE deleted_at IS NOT NULL AND deleted_at >= :since "
            + "ORDER BY deleted_at DESC LIMIT :limit")
    Flux<Post> findDeletedSince(LocalDateTime since, int limit);
}
