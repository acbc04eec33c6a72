package dev.sidechain.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A user's presence as seen by someone else, after their visibility flags are applied.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PresenceView {
    private String userId;
    @JsonProperty("isOnline")
    private boolean online;
    private String status;
    private String customStatus;
    private String daw;
    private Instant lastActiveAt;

    public static PresenceView hidden(String userId) {
        return PresenceView.builder()
                .userId(userId)
                .online(false)
                .status("offline")
                .build();
    }
}
