package tech.unifiedportal.sdk.exception;

import com.fasterxml.jackson.databind.JsonNode;
import tech.unifiedportal.sdk.enums.ErrorType;
import tech.unifiedportal.sdk.enums.HttpMethod;

import java.util.Locale;

/**
 * The call could not be constructed or handed to the transport.
 */
public class RequestErrorException extends PortalClientException {

    public RequestErrorException(String message, Throwable cause) {
        super(ErrorType.REQUEST_ERROR, message, cause);
    }

    public static RequestErrorException invalidTarget(String target, Throwable cause) {
        return new RequestErrorException("Invalid call target: " + target, cause);
    }

    public static RequestErrorException missingMethod(String target) {
        return new RequestErrorException("No HTTP method given for call target: " + target, null);
    }

    public static RequestErrorException invalidQueryParams(HttpMethod method, JsonNode params) {
        return new RequestErrorException(method + " parameters must be a JSON object, got "
            + params.getNodeType().name().toLowerCase(Locale.ROOT), null);
    }

    public static RequestErrorException unserializablePayload(Throwable cause) {
        return new RequestErrorException("Failed to serialize call payload", cause);
    }

    public static RequestErrorException couldNotSend(Throwable cause) {
        String detail = cause != null && cause.getMessage() != null ? cause.getMessage() : "unknown error";
        return new RequestErrorException("Request could not be sent: " + detail, cause);
    }

    public static RequestErrorException clientClosed() {
        return new RequestErrorException("Client has been closed", null);
    }
}
