package tech.unifiedportal.sdk.client;

/**
 * Lifecycle of a single call inside the client.
 */
enum CallState {
    NEW,
    CACHE_CHECK,
    CACHE_HIT,
    QUEUED,
    EXECUTING,
    SUCCESS,
    AUTH_EXPIRED,
    BACKOFF,
    RETRY,
    TERMINAL_FAILURE
}
