package dev.sidechain.dto;

import dev.sidechain.websocket.message.DomainEvent;
import dev.sidechain.websocket.message.MessageType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of {@code POST /api/v1/internal/events}, sent by the services that own posts,
 * follows, comments, stories, challenges and messages after their write commits.
 * Which optional fields are read depends on {@code type}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DispatchEventRequest {

    @NotBlank(message = "type is required")
    private String type;

    @NotBlank(message = "actorId is required")
    private String actorId;

    private String actorName;

    /** Post, user, story, challenge or conversation id, depending on type. */
    @NotBlank(message = "objectId is required")
    private String objectId;

    @NotEmpty(message = "recipients must not be empty")
    @Size(max = 10_000, message = "At most 10000 recipients per event")
    private List<String> recipients;

    private String commentId;
    private String repostId;
    private String messageId;
    @Size(max = 5_000)
    private String body;
    private Integer count;
    private String emoji;
    private String genre;
    private Integer bpm;
    private String musicalKey;
    private String daw;
    private String title;
    private String status;

    /**
     * @throws IllegalArgumentException for a type that is not a dispatchable domain event
     */
    public DomainEvent toDomainEvent() {
        return switch (type) {
            case MessageType.NEW_POST -> new DomainEvent.NewPost(actorId, actorName, objectId, genre, bpm, musicalKey, daw);
            case MessageType.POST_LIKED -> new DomainEvent.PostLiked(actorId, actorName, objectId, count, emoji);
            case MessageType.POST_COMMENTED -> new DomainEvent.PostCommented(actorId, actorName, objectId, commentId, body);
            case MessageType.POST_SAVED -> new DomainEvent.PostSaved(actorId, actorName, objectId);
            case MessageType.POST_REPOSTED -> new DomainEvent.PostReposted(actorId, actorName, objectId, repostId);
            case MessageType.USER_FOLLOWED -> new DomainEvent.UserFollowed(actorId, actorName, objectId, count);
            case MessageType.USER_MENTIONED -> new DomainEvent.UserMentioned(actorId, actorName, objectId, commentId, body);
            case MessageType.NEW_STORY -> new DomainEvent.StoryPosted(actorId, actorName, objectId);
            case MessageType.CHALLENGE_UPDATE -> new DomainEvent.ChallengeUpdated(actorId, actorName, objectId, title, status);
            case MessageType.NEW_MESSAGE -> new DomainEvent.DirectMessageReceived(actorId, actorName, objectId, messageId, body);
            default -> throw new IllegalArgumentException("Unknown event type: " + type);
        };
    }
}
