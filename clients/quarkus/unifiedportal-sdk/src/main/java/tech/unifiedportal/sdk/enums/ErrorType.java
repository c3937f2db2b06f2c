package tech.unifiedportal.sdk.enums;

/**
 * Normalized failure categories surfaced to callers.
 */
public enum ErrorType {
    /** The remote service answered with an error status. */
    API_ERROR,
    /** No response was received (connection failure, timeout). */
    NETWORK_ERROR,
    /** The call could not be constructed or sent. */
    REQUEST_ERROR,
    /** Credential renewal failed; the user has to authenticate again. */
    AUTH_FAILURE
}
