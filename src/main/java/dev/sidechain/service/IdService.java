package dev.sidechain.service;

import dev.sidechain.util.SnowflakeId;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Issues Snowflake ids for notification events and live connections.
 *
 * <pre>
 * String eventId = idService.nextEventId();
 * Instant createdAt = idService.getCreatedInstant(eventId);
 * </pre>
 */
@Service
@RequiredArgsConstructor
public class IdService {

    private static final String CONNECTION_PREFIX = "conn-";

    private final SnowflakeId snowflakeId;

    public long nextId() {
        return snowflakeId.nextId();
    }

    /**
     * Event ids travel as strings on the wire and in the feed store.
     */
    public String nextEventId() {
        return Long.toString(snowflakeId.nextId());
    }

    public String nextConnectionId() {
        return CONNECTION_PREFIX + snowflakeId.nextId();
    }

    /**
     * @return the creation instant, or {@code null} if the id is not a Snowflake id
     */
    public Instant getCreatedInstant(String eventId) {
        if (eventId == null) {
            return null;
        }
        try {
            return SnowflakeId.extractInstant(Long.parseLong(eventId));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
