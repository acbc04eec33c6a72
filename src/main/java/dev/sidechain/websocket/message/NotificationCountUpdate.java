package dev.sidechain.websocket.message;

public record NotificationCountUpdate(long unreadCount, long unseenCount, long timestamp) {
}
