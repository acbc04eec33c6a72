package dev.sidechain.entity;

import java.util.Locale;

public enum PresenceStatus {
    ONLINE,
    IN_STUDIO,
    OFFLINE;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Statuses a client may report. Anything other than {@code in_studio} counts as online;
     * clients cannot report themselves offline while connected.
     */
    public static PresenceStatus fromClient(String value) {
        if (value != null && "in_studio".equalsIgnoreCase(value.trim())) {
            return IN_STUDIO;
        }
        return ONLINE;
    }
}
