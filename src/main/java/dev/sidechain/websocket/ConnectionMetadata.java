package dev.sidechain.websocket;

public record ConnectionMetadata(String remoteAddress, String userAgent) {

    public static final ConnectionMetadata UNKNOWN = new ConnectionMetadata(null, null);
}
