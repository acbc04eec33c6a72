package dev.sidechain.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Consecutive notifications with the same verb and day, collapsed for display.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NotificationGroup {
    /** Id of the group's first event. */
    private String id;
    private String verb;
    private String groupKey;
    private String actorId;
    private String actorName;
    private int actorCount;
    private int activityCount;
    private String objectId;
    private String text;
    private boolean read;
    private boolean seen;
    private Instant createdAt;
    private Instant updatedAt;
}
