package dev.sidechain.service.search;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import dev.sidechain.entity.Post;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

/**
 * The {@code posts} index document. The relational row is the source of truth.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PostSearchDocument(String id, String userId, String username, List<String> genre, Integer bpm,
                                 String key, String daw, int likeCount, int playCount, int commentCount,
                                 Instant createdAt) {

    public static PostSearchDocument from(Post post) {
        return new PostSearchDocument(
                post.getId(),
                post.getUserId(),
                post.getUsername(),
                UserSearchDocument.splitGenres(post.getGenre()),
                post.getBpm(),
                post.getMusicalKey(),
                post.getDaw(),
                post.getLikeCount() != null ? post.getLikeCount() : 0,
                post.getPlayCount() != null ? post.getPlayCount() : 0,
                post.getCommentCount() != null ? post.getCommentCount() : 0,
                post.getCreatedAt() != null ? post.getCreatedAt().toInstant(ZoneOffset.UTC) : null);
    }
}
