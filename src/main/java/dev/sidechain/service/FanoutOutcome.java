package dev.sidechain.service;

import java.util.Locale;

/**
 * What happened to one recipient of a dispatched event.
 */
public enum FanoutOutcome {
    /** Queued on at least one live connection. */
    DELIVERED,
    /** Recipient offline; written to their durable feed. */
    QUEUED,
    /** Recipient offline and the event kind is live-only. */
    SKIPPED_OFFLINE,
    SUPPRESSED_RELATIONSHIP,
    SUPPRESSED_PREFERENCE,
    FAILED;

    public String metricTag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
