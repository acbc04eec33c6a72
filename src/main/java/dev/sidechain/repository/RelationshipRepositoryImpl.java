package dev.sidechain.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
@RequiredArgsConstructor
public class RelationshipRepositoryImpl implements RelationshipRepository {

    private final R2dbcEntityTemplate r2dbcTemplate;

    private static final String FIND_FOLLOWERS =
            "SELECT follower_id FROM follows WHERE following_id = :userId ORDER BY created_at DESC LIMIT :limit";

    private static final String FIND_FOLLOWING =
            "SELECT following_id FROM follows WHERE follower_id = :userId ORDER BY created_at DESC LIMIT :limit";

    private static final String COUNT_SUPPRESSIONS =
            "SELECT "
            + "(SELECT COUNT(*) FROM user_mutes WHERE user_id = :recipientId AND muted_user_id = :actorId) + "
            + "(SELECT COUNT(*) FROM user_blocks WHERE (blocker_id = :recipientId AND blocked_id = :actorId) "
            + "OR (blocker_id = :actorId AND blocked_id = :recipientId)) AS cnt";

    @Override
    public Flux<String> findFollowerIds(String userId, int limit) {
        return r2dbcTemplate.getDatabaseClient()
                .sql(FIND_FOLLOWERS)
                .bind("userId", userId)
                .bind("limit", limit)
                .map((row, meta) -> row.get("follower_id", String.class))
                .all();
    }

    @Override
    public Flux<String> findFollowingIds(String userId, int limit) {
        return r2dbcTemplate.getDatabaseClient()
                .sql(FIND_FOLLOWING)
                .bind("userId", userId)
                .bind("limit", limit)
                .map((row, meta) -> row.get("following_id", String.class))
                .all();
    }

    @Override
    public Mono<Boolean> isSuppressed(String recipientId, String actorId) {
        return r2dbcTemplate.getDatabaseClient()
                .sql(COUNT_SUPPRESSIONS)
                .bind("recipientId", recipientId)
                .bind("actorId", actorId)
                .map((row, meta) -> row.get("cnt", Long.class))
                .one()
                .map(count -> count != null && count > 0)
                .defaultIfEmpty(false);
    }
}
