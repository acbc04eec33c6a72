package dev.sidechain.service.feed;

/**
 * Badge counts, in notification groups.
 */
public record NotificationCounts(int unread, int unseen) {

    public static final NotificationCounts ZERO = new NotificationCounts(0, 0);
}
