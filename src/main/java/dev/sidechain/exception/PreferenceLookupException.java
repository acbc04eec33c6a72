package dev.sidechain.exception;

public class PreferenceLookupException extends RuntimeException {

    public PreferenceLookupException(String userId, Throwable cause) {
        super("Preference lookup failed for user " + userId, cause);
    }
}
