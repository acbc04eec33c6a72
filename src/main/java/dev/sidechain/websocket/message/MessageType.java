package dev.sidechain.websocket.message;

/**
 * Wire values of the envelope {@code type} field.
 */
public final class MessageType {

    // connection-level
    public static final String SYSTEM = "system";
    public static final String PING = "ping";
    public static final String HEARTBEAT = "heartbeat";
    public static final String PONG = "pong";
    public static final String AUTH = "auth";
    public static final String ERROR = "error";

    // presence and typing
    public static final String PRESENCE = "presence";
    public static final String USER_IN_STUDIO = "user_in_studio";
    public static final String PRESENCE_CHANGED = "presence_changed";
    public static final String USER_TYPING = "user_typing";
    public static final String USER_STOP_TYPING = "user_stop_typing";

    // domain events
    public static final String NEW_POST = "new_post";
    public static final String POST_LIKED = "post_liked";
    public static final String POST_COMMENTED = "post_commented";
    public static final String POST_SAVED = "post_saved";
    public static final String POST_REPOSTED = "post_reposted";
    public static final String USER_FOLLOWED = "user_followed";
    public static final String USER_MENTIONED = "user_mentioned";
    public static final String NEW_STORY = "new_story";
    public static final String CHALLENGE_UPDATE = "challenge_update";
    public static final String NEW_MESSAGE = "new_message";

    public static final String NOTIFICATION_COUNT_UPDATE = "notification_count_update";

    private MessageType() {
    }
}
