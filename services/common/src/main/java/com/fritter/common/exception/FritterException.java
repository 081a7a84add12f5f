package com.fritter.common.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Base class for every domain error raised by Fritter services.
 *
 * Each subclass fixes the HTTP status and error code it maps to, so that
 * {@link GlobalExceptionHandler} can translate it without knowing the concrete type.
 * Metadata is optional context (ids, states) that ends up in the error body.
 */
@Getter
public abstract class FritterException extends RuntimeException {

    private final String errorId;
    private final String errorCode;
    private final HttpStatus status;
    private final Map<String, Object> metadata;

    protected FritterException(String message, String errorCode, HttpStatus status) {
        super(message);
        this.errorId = UUID.randomUUID().toString();
        this.errorCode = errorCode;
        this.status = status;
        this.metadata = new HashMap<>();
    }

    protected FritterException(String message, String errorCode, HttpStatus status, Throwable cause) {
        super(message, cause);
        this.errorId = UUID.randomUUID().toString();
        this.errorCode = errorCode;
        this.status = status;
        this.metadata = new HashMap<>();
    }

    /**
     * Add a metadata entry (fluent). Null keys and values are ignored.
     */
    public FritterException withMetadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, value);
        }
        return this;
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    @Override
    public String toString() {
        return String.format("%s[errorId=%s, errorCode=%s, message=%s, metadata=%s]",
            getClass().getSimpleName(), errorId, errorCode, getMessage(), metadata);
    }
}
