package dev.sidechain.service;

import dev.sidechain.dto.NotificationGroup;
import dev.sidechain.service.feed.NotificationEvent;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Turns a recipient's raw notification events into display groups. No I/O.
 */
@Component
public class NotificationAggregationPresenter {

    static final int PREVIEW_LENGTH = 50;
    static final String FALLBACK_NAME = "Someone";

    /**
     * @param oldestFirst one recipient's events, oldest first; may contain the same id twice
     * @return groups, newest first
     */
    public List<NotificationGroup> present(List<NotificationEvent> oldestFirst) {
        List<NotificationGroup> groups = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();
        Accumulator current = null;

        for (NotificationEvent event : oldestFirst) {
            if (event.id() != null && !seenIds.add(event.id())) {
                continue;
            }
            if (current == null || !current.accepts(event)) {
                if (current != null) {
                    groups.add(current.toGroup());
                }
                current = new Accumulator(event);
            } else {
                current.add(event);
            }
        }
        if (current != null) {
            groups.add(current.toGroup());
        }
        Collections.reverse(groups);
        return groups;
    }

    /**
     * {@code "Alice liked your loop"}, {@code "Alice and 2 others liked your loop"}.
     */
    public static String displayText(String verb, String actorName, int actorCount, String preview) {
        String name = actorName == null || actorName.isBlank() ? FALLBACK_NAME : actorName;
        StringBuilder text = new StringBuilder(name);
        int others = actorCount - 1;
        if (others > 0) {
            text.append(" and ").append(others).append(others == 1 ? " other" : " others");
        }
        return text.append(' ').append(phrase(verb, preview)).toString();
    }

    static String phrase(String verb, String preview) {
        String v = verb == null ? "" : verb;
        return switch (v) {
            case "like" -> "liked your loop";
            case "follow" -> "started following you";
            case "comment" -> withPreview("commented on your loop", preview);
            case "mention" -> withPreview("mentioned you", preview);
            case "repost" -> "reposted your loop";
            default -> v;
        };
    }

    private static String withPreview(String phrase, String preview) {
        if (preview == null || preview.isBlank()) {
            return phrase;
        }
        return phrase + ": \"" + truncate(preview) + "\"";
    }

    static String truncate(String text) {
        return text.length() > PREVIEW_LENGTH ? text.substring(0, PREVIEW_LENGTH) + "..." : text;
    }

    private static final class Accumulator {
        private final NotificationEvent first;
        private NotificationEvent latest;
        private final Set<String> actors = new LinkedHashSet<>();
        private int activityCount;
        private boolean read = true;
        private boolean seen = true;

        private Accumulator(NotificationEvent first) {
            this.first = first;
            add(first);
        }

        private boolean accepts(NotificationEvent event) {
            return Objects.equals(first.verb(), event.verb())
                    && first.aggregationKey().equals(event.aggregationKey());
        }

        private void add(NotificationEvent event) {
            latest = event;
            actors.add(event.actorId());
            activityCount++;
            read &= event.read();
            seen &= event.seen();
        }

        private NotificationGroup toGroup() {
            return NotificationGroup.builder()
                    .id(first.id())
                    .verb(first.verb())
                    .groupKey(first.aggregationKey())
                    .actorId(first.actorId())
                    .actorName(first.actorName())
                    .actorCount(actors.size())
                    .activityCount(activityCount)
                    .objectId(latest.objectId())
                    .text(displayText(first.verb(), first.actorName(), actors.size(), first.preview()))
                    .read(read)
                    .seen(seen)
                    .createdAt(first.time())
                    .updatedAt(latest.time())
                    .build();
        }
    }
}
