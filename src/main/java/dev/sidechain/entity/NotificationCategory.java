package dev.sidechain.entity;

import java.util.Arrays;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Categories a user can switch off. The wire key is the column name on
 * {@code notification_preferences}.
 */
public enum NotificationCategory {

    LIKES("likes", NotificationPreference::getLikes, NotificationPreference::setLikes),
    COMMENTS("comments", NotificationPreference::getComments, NotificationPreference::setComments),
    FOLLOWS("follows", NotificationPreference::getFollows, NotificationPreference::setFollows),
    MENTIONS("mentions", NotificationPreference::getMentions, NotificationPreference::setMentions),
    DMS("dms", NotificationPreference::getDms, NotificationPreference::setDms),
    STORIES("stories", NotificationPreference::getStories, NotificationPreference::setStories),
    REPOSTS("reposts", NotificationPreference::getReposts, NotificationPreference::setReposts),
    CHALLENGES("challenges", NotificationPreference::getChallenges, NotificationPreference::setChallenges);

    private final String key;
    private final Function<NotificationPreference, Boolean> reader;
    private final BiConsumer<NotificationPreference, Boolean> writer;

    NotificationCategory(String key,
                         Function<NotificationPreference, Boolean> reader,
                         BiConsumer<NotificationPreference, Boolean> writer) {
        this.key = key;
        this.reader = reader;
        this.writer = writer;
    }

    public String key() {
        return key;
    }

    /** A null column reads as enabled. */
    public boolean isEnabledIn(NotificationPreference preference) {
        return !Boolean.FALSE.equals(reader.apply(preference));
    }

    public void applyTo(NotificationPreference preference, boolean enabled) {
        writer.accept(preference, enabled);
    }

    public static Optional<NotificationCategory> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(c -> c.key.equalsIgnoreCase(key.trim()))
                .findFirst();
    }
}
