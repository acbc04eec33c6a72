package dev.sidechain.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.ReadOnlyProperty;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Audio post ("loop"). Read-only from this service; the reconciliation sweeper
 * projects it into the search index.
 */
@Table("posts")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Post {

    @Id
    private String id;

    @Column("user_id")
    private String userId;

    /** Joined from {@code users.username} by the sampling query. */
    @ReadOnlyProperty
    private String username;

    private String genre;

    private Integer bpm;

    @Column("musical_key")
    private String musicalKey;

    private String daw;

    @Column("like_count")
    private Integer likeCount;

    @Column("play_count")
    private Integer playCount;

    @Column("comment_count")
    private Integer commentCount;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("deleted_at")
    private LocalDateTime deletedAt;
}
