package dev.sidechain.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.domain.Persistable;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Projection of the account row this subsystem reads. Only the presence columns
 * ({@code is_online}, {@code last_active_at}) and the two visibility flags are written here.
 */
@Table("users")
@Getter
@Setter
@ToString
@EqualsAndHashCode(of = "id")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User implements Persistable<String>, NewRecordAware {

    @Id
    private String id;

    @Transient
    @Builder.Default
    private boolean newRecord = true;

    @Override
    public boolean isNew() {
        return newRecord;
    }

    private String username;

    @Column("display_name")
    private String displayName;

    private String bio;

    private String genre;

    @Builder.Default
    private String role = "USER";

    @Builder.Default
    private Boolean active = true;

    @Column("follower_count")
    @Builder.Default
    private Integer followerCount = 0;

    @Column("show_activity_status")
    @Builder.Default
    private Boolean showActivityStatus = true;

    @Column("show_last_active")
    @Builder.Default
    private Boolean showLastActive = true;

    @Column("is_online")
    @Builder.Default
    private Boolean online = false;

    @Column("last_active_at")
    private LocalDateTime lastActiveAt;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;
}
