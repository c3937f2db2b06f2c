package tech.unifiedportal.sdk.exception;

import com.fasterxml.jackson.databind.JsonNode;
import tech.unifiedportal.sdk.enums.ErrorType;

/**
 * The remote service responded with an error status.
 */
public class ApiErrorException extends PortalClientException {

    public ApiErrorException(String message, int statusCode, JsonNode body, String errorCode) {
        super(ErrorType.API_ERROR, message, statusCode, body, errorCode, null);
    }

    /**
     * Build from an error response. The body's {@code message} and {@code code}
     * fields are used when present.
     */
    public static ApiErrorException fromResponse(int statusCode, JsonNode body) {
        String message = textField(body, "message");
        if (message == null) {
            message = "Request failed with status code " + statusCode;
        }
        return new ApiErrorException(message, statusCode, body, textField(body, "code"));
    }

    private static String textField(JsonNode body, String field) {
        if (body == null || !body.isObject()) {
            return null;
        }
        JsonNode value = body.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }
}
