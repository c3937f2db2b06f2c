package tech.unifiedportal.sdk.exception;

import tech.unifiedportal.sdk.enums.ErrorType;

/**
 * Credential renewal failed. The hosting application has to authenticate again.
 */
public class AuthenticationException extends PortalClientException {

    public AuthenticationException(String message) {
        super(ErrorType.AUTH_FAILURE, message, 401, null, null, null);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(ErrorType.AUTH_FAILURE, message, 401, null, null, cause);
    }

    public static AuthenticationException missingRefreshToken() {
        return new AuthenticationException("No refresh token available");
    }

    public static AuthenticationException renewalFailed(Throwable cause) {
        return new AuthenticationException("Credential renewal failed", cause);
    }

    public static AuthenticationException invalidRenewalResponse() {
        return new AuthenticationException("Renewal response did not contain an access token");
    }
}
