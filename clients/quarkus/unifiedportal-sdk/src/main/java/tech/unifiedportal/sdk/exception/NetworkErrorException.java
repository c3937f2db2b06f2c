package tech.unifiedportal.sdk.exception;

import tech.unifiedportal.sdk.enums.ErrorType;

/**
 * No response was received from the remote service.
 */
public class NetworkErrorException extends PortalClientException {

    public NetworkErrorException(String message, Throwable cause) {
        super(ErrorType.NETWORK_ERROR, message, cause);
    }

    public static NetworkErrorException connectionFailed(Throwable cause) {
        return new NetworkErrorException("Network connection failed", cause);
    }

    public static NetworkErrorException timedOut(Throwable cause) {
        return new NetworkErrorException("Request timed out", cause);
    }
}
