package dev.sidechain.websocket.message;

import dev.sidechain.entity.NotificationCategory;

import java.util.Optional;

/**
 * Closed set of domain events the fan-out router delivers. Each kind carries its
 * own typed fields and declares how it is gated, rendered and stored.
 * <p>
 * The record itself is the envelope payload, so record components are what the
 * client sees (snake_cased by {@link MessageCodec}).
 * </p>
 */
public sealed interface DomainEvent {

    String actorId();

    String actorName();

    /** Id of the thing acted upon; becomes the feed activity object. */
    String objectId();

    /** Envelope {@code type}. */
    String messageType();

    /** Feed verb; drives aggregation and display text. */
    String verb();

    /**
     * Preference category gating this event. Empty means the kind has no switch
     * of its own and is always delivered.
     */
    Optional<NotificationCategory> category();

    /** Whether an offline recipient gets the event written to the durable feed. */
    boolean durable();

    /** Text shown after the verb phrase (comment body, mention snippet). */
    default String preview() {
        return null;
    }

    record NewPost(String actorId, String actorName, String postId, String genre, Integer bpm,
                   String musicalKey, String daw) implements DomainEvent {
        public String objectId() { return postId; }
        public String messageType() { return MessageType.NEW_POST; }
        public String verb() { return "post"; }
        public Optional<NotificationCategory> category() { return Optional.empty(); }
        public boolean durable() { return false; }
    }

    record PostLiked(String actorId, String actorName, String postId, Integer likeCount, String emoji)
            implements DomainEvent {
        public String objectId() { return postId; }
        public String messageType() { return MessageType.POST_LIKED; }
        public String verb() { return "like"; }
        public Optional<NotificationCategory> category() { return Optional.of(NotificationCategory.LIKES); }
        public boolean durable() { return true; }
    }

    record PostCommented(String actorId, String actorName, String postId, String commentId, String body)
            implements DomainEvent {
        public String objectId() { return postId; }
        public String messageType() { return MessageType.POST_COMMENTED; }
        public String verb() { return "comment"; }
        public Optional<NotificationCategory> category() { return Optional.of(NotificationCategory.COMMENTS); }
        public boolean durable() { return true; }
        @Override
        public String preview() { return body; }
    }

    record PostSaved(String actorId, String actorName, String postId) implements DomainEvent {
        public String objectId() { return postId; }
        public String messageType() { return MessageType.POST_SAVED; }
        public String verb() { return "save"; }
        public Optional<NotificationCategory> category() { return Optional.empty(); }
        public boolean durable() { return false; }
    }

    record PostReposted(String actorId, String actorName, String postId, String repostId)
            implements DomainEvent {
        public String objectId() { return postId; }
        public String messageType() { return MessageType.POST_REPOSTED; }
        public String verb() { return "repost"; }
        public Optional<NotificationCategory> category() { return Optional.of(NotificationCategory.REPOSTS); }
        public boolean durable() { return true; }
    }

    record UserFollowed(String actorId, String actorName, String followeeId, Integer followerCount)
            implements DomainEvent {
        public String objectId() { return followeeId; }
        public String messageType() { return MessageType.USER_FOLLOWED; }
        public String verb() { return "follow"; }
        public Optional<NotificationCategory> category() { return Optional.of(NotificationCategory.FOLLOWS); }
        public boolean durable() { return true; }
    }

    record UserMentioned(String actorId, String actorName, String postId, String commentId, String body)
            implements DomainEvent {
        public String objectId() { return commentId != null ? commentId : postId; }
        public String messageType() { return MessageType.USER_MENTIONED; }
        public String verb() { return "mention"; }
        public Optional<NotificationCategory> category() { return Optional.of(NotificationCategory.MENTIONS); }
        public boolean durable() { return true; }
        @Override
        public String preview() { return body; }
    }

    record StoryPosted(String actorId, String actorName, String storyId) implements DomainEvent {
        public String objectId() { return storyId; }
        public String messageType() { return MessageType.NEW_STORY; }
        public String verb() { return "story"; }
        public Optional<NotificationCategory> category() { return Optional.of(NotificationCategory.STORIES); }
        // stories expire within a day; an offline follower sees them on the story tray instead
        public boolean durable() { return false; }
    }

    record ChallengeUpdated(String actorId, String actorName, String challengeId, String title, String status)
            implements DomainEvent {
        public String objectId() { return challengeId; }
        public String messageType() { return MessageType.CHALLENGE_UPDATE; }
        public String verb() { return "challenge"; }
        public Optional<NotificationCategory> category() { return Optional.of(NotificationCategory.CHALLENGES); }
        public boolean durable() { return true; }
        @Override
        public String preview() { return title; }
    }

    record DirectMessageReceived(String actorId, String actorName, String conversationId, String messageId,
                                 String snippet) implements DomainEvent {
        public String objectId() { return conversationId; }
        public String messageType() { return MessageType.NEW_MESSAGE; }
        public String verb() { return "message"; }
        public Optional<NotificationCategory> category() { return Optional.of(NotificationCategory.DMS); }
        // message history is owned by the chat service
        public boolean durable() { return false; }
        @Override
        public String preview() { return snippet; }
    }
}
