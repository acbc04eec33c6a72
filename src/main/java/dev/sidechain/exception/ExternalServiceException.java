package dev.sidechain.exception;

import lombok.Getter;

/**
 * A backing service (feed store, search index, cache) was unreachable or
 * rejected the call. Callers degrade rather than fail the whole request.
 */
@Getter
public class ExternalServiceException extends RuntimeException {

    private final String service;

    public ExternalServiceException(String service, String message) {
        super(message);
        this.service = service;
    }

    public ExternalServiceException(String service, String message, Throwable cause) {
        super(message, cause);
        this.service = service;
    }
}
