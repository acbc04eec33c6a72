package dev.sidechain.exception;

/**
 * A WebSocket handshake or registration was refused.
 * The connection never reaches the registry and is not retried server-side.
 */
public class ConnectionException extends RuntimeException {

    public ConnectionException(String message) {
        super(message);
    }
}
