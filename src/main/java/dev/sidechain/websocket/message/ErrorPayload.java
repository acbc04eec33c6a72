package dev.sidechain.websocket.message;

public record ErrorPayload(String code, String message) {

    public static final String INVALID_JSON = "invalid_json";
    public static final String UNKNOWN_TYPE = "unknown_type";
    public static final String RATE_LIMITED = "rate_limited";
    public static final String HANDLER_ERROR = "handler_error";
}
