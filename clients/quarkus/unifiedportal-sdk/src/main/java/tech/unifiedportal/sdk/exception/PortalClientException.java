package tech.unifiedportal.sdk.exception;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import tech.unifiedportal.sdk.enums.ErrorType;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Base exception for every failure the portal client surfaces to callers.
 *
 * <p>Callers never see raw transport exceptions: anything escaping the transport
 * is translated through {@link #normalize(Throwable)}.
 */
public class PortalClientException extends RuntimeException {

    private final ErrorType type;
    private final int statusCode;
    private final JsonNode body;
    private final String errorCode;

    public PortalClientException(ErrorType type, String message) {
        this(type, message, 0, null, null, null);
    }

    public PortalClientException(ErrorType type, String message, Throwable cause) {
        this(type, message, 0, null, null, cause);
    }

    public PortalClientException(ErrorType type, String message, int statusCode,
                                 JsonNode body, String errorCode, Throwable cause) {
        super(message, cause);
        this.type = type;
        this.statusCode = statusCode;
        this.body = body;
        this.errorCode = errorCode;
    }

    public ErrorType getType() {
        return type;
    }

    /**
     * HTTP status of the failed call, or 0 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public JsonNode getBody() {
        return body;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Translate any failure into the client's error taxonomy.
     */
    public static PortalClientException normalize(Throwable failure) {
        Throwable cause = unwrap(failure);
        if (cause instanceof PortalClientException portalException) {
            return portalException;
        }
        if (cause instanceof HttpTimeoutException timeout) {
            return NetworkErrorException.timedOut(timeout);
        }
        if (cause instanceof IOException io && !(cause instanceof JsonProcessingException)) {
            return NetworkErrorException.connectionFailed(io);
        }
        return RequestErrorException.couldNotSend(cause);
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
