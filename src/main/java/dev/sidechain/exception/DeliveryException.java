package dev.sidechain.exception;

import lombok.Getter;

/**
 * A message could not be handed to one live connection, either because its
 * outbound queue was full or because the session had already terminated.
 */
@Getter
public class DeliveryException extends RuntimeException {

    private final String connectionId;

    public DeliveryException(String connectionId, String message) {
        super(message);
        this.connectionId = connectionId;
    }
}
