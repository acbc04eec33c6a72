package dev.sidechain.websocket;

/**
 * Notified when a user gains their first or loses their last live connection on this node.
 * Called synchronously on the registering/unregistering thread; implementations must not block.
 */
public interface ConnectionListener {

    void onFirstConnection(String userId, String username);

    void onLastDisconnect(String userId);
}
