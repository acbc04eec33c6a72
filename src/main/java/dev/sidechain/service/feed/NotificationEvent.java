package dev.sidechain.service.feed;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * One activity in a user's durable notification feed.
 *
 * @param id       the fan-out event id; identical to the id of the live envelope for the same event
 * @param objectId what was acted upon (post, comment, user, challenge)
 * @param preview  optional text shown after the verb phrase
 */
public record NotificationEvent(String id, String recipientId, String actorId, String actorName, String verb,
                                String objectId, String preview, Instant time, boolean read, boolean seen) {

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);

    /**
     * Events sharing this key and verb collapse into one group: {@code like_2024-03-01}.
     */
    public String aggregationKey() {
        return verb + "_" + DAY.format(time);
    }

    public NotificationEvent markRead() {
        return read ? this : new NotificationEvent(id, recipientId, actorId, actorName, verb, objectId, preview,
                time, true, true);
    }

    public NotificationEvent markSeen() {
        return seen ? this : new NotificationEvent(id, recipientId, actorId, actorName, verb, objectId, preview,
                time, read, true);
    }
}
