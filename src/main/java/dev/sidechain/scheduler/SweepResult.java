package dev.sidechain.scheduler;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of one reconciliation pass. Counts are documents upserted or removed before any abort.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SweepResult(int postsIndexed, int usersIndexed, int postsRemoved, int usersRemoved,
                          boolean skipped, String error) {

    public static SweepResult skipped(String reason) {
        return new SweepResult(0, 0, 0, 0, true, reason);
    }
}
