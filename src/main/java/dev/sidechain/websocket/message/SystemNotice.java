package dev.sidechain.websocket.message;

import java.util.Map;

public record SystemNotice(String event, String message, Map<String, Object> data) {

    public static final String CONNECTED = "connected";
    public static final String SERVER_SHUTDOWN = "server_shutdown";
}
