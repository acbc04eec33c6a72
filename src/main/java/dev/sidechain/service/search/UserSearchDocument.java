package dev.sidechain.service.search;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import dev.sidechain.entity.User;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

/**
 * The {@code users} index document.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UserSearchDocument(String id, String username, String displayName, String bio, List<String> genre,
                                 int followerCount, Instant createdAt) {

    public static UserSearchDocument from(User user) {
        return new UserSearchDocument(
                user.getId(),
                user.getUsername(),
                user.getDisplayName(),
                user.getBio(),
                splitGenres(user.getGenre()),
                user.getFollowerCount() != null ? user.getFollowerCount() : 0,
                user.getCreatedAt() != null ? user.getCreatedAt().toInstant(ZoneOffset.UTC) : null);
    }

    /** Genres are stored comma-separated. */
    static List<String> splitGenres(String genre) {
        if (genre == null || genre.isBlank()) {
            return List.of();
        }
        return Arrays.stream(genre.split(","))
                .map(String::trim)
                .filter(g -> !g.isEmpty())
                .toList();
    }
}
