package dev.sidechain.service;

import dev.sidechain.entity.PresenceStatus;

import java.time.Instant;

/**
 * In-memory presence of one user on this node. Replaced wholesale on every change.
 */
public record PresenceState(String userId, String username, PresenceStatus status, String customStatus,
                            String daw, Instant lastActiveAt) {

    static PresenceState online(String userId, String username, String customStatus, Instant now) {
        return new PresenceState(userId, username, PresenceStatus.ONLINE, customStatus, null, now);
    }

    boolean isActive() {
        return status != PresenceStatus.OFFLINE;
    }

    PresenceState touch(Instant now) {
        return new PresenceState(userId, username, status, customStatus, daw, now);
    }

    PresenceState offline(Instant now) {
        return new PresenceState(userId, username, PresenceStatus.OFFLINE, customStatus, null, now);
    }

    PresenceState withStatus(PresenceStatus newStatus, String newDaw, Instant now) {
        return new PresenceState(userId, username, newStatus, customStatus, newDaw, now);
    }

    PresenceState withCustomStatus(String text) {
        return new PresenceState(userId, username, status, text, daw, lastActiveAt);
    }
}
