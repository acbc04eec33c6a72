package dev.sidechain.service;

import java.time.Instant;

/**
 * A subject's presence visibility flags plus the last-active time persisted on their account row.
 */
public record ActivityVisibility(String userId, String username, boolean showActivityStatus,
                                 boolean showLastActive, Instant persistedLastActiveAt) {

    public static ActivityVisibility defaults(String userId) {
        return new ActivityVisibility(userId, null, true, true, null);
    }
}
