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
 * One row per user, created on first write. Every category defaults to enabled.
 */
@Table("notification_preferences")
@Getter
@Setter
@ToString
@EqualsAndHashCode(of = "userId")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationPreference implements Persistable<String>, NewRecordAware {

    @Id
    @Column("user_id")
    private String userId;

    @Transient
    @Builder.Default
    private boolean newRecord = true;

    @Override
    public String getId() {
        return userId;
    }

    @Override
    public boolean isNew() {
        return newRecord;
    }

    @Builder.Default
    private Boolean likes = true;

    @Builder.Default
    private Boolean comments = true;

    @Builder.Default
    private Boolean follows = true;

    @Builder.Default
    private Boolean mentions = true;

    @Builder.Default
    private Boolean dms = true;

    @Builder.Default
    private Boolean stories = true;

    @Builder.Default
    private Boolean reposts = true;

    @Builder.Default
    private Boolean challenges = true;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;

    public static NotificationPreference defaultsFor(String userId) {
        return NotificationPreference.builder().userId(userId).build();
    }
}
