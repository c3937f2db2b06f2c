package tech.unifiedportal.sdk.client;

import com.fasterxml.jackson.databind.JsonNode;
import tech.unifiedportal.sdk.client.retry.ScheduledRetry;
import tech.unifiedportal.sdk.enums.HttpMethod;
import tech.unifiedportal.sdk.support.TsidGenerator;

import java.util.concurrent.CompletableFuture;

/**
 * Mutable per-call state carried across attempts.
 */
final class PendingCall {

    private final String id = TsidGenerator.unitId();
    private final HttpMethod method;
    private final String target;
    private final JsonNode payload;
    private final CallOptions options;
    private final String cacheKey;
    private final CompletableFuture<CallResult> result = new CompletableFuture<>();

    private volatile CallState state = CallState.NEW;
    private volatile int retryCount;
    private volatile boolean retriedAfterRenewal;
    private volatile ScheduledRetry pendingRetry;

    PendingCall(HttpMethod method, String target, JsonNode payload, CallOptions options, String cacheKey) {
        this.method = method;
        this.target = target;
        this.payload = payload;
        this.options = options;
        this.cacheKey = cacheKey;
    }

    String id() {
        return id;
    }

    HttpMethod method() {
        return method;
    }

    String target() {
        return target;
    }

    JsonNode payload() {
        return payload;
    }

    CallOptions options() {
        return options;
    }

    String cacheKey() {
        return cacheKey;
    }

    CompletableFuture<CallResult> result() {
        return result;
    }

    void transition(CallState next) {
        this.state = next;
    }

    int retryCount() {
        return retryCount;
    }

    void incrementRetryCount() {
        retryCount++;
    }

    boolean retriedAfterRenewal() {
        return retriedAfterRenewal;
    }

    void markRetriedAfterRenewal() {
        this.retriedAfterRenewal = true;
    }

    ScheduledRetry pendingRetry() {
        return pendingRetry;
    }

    void setPendingRetry(ScheduledRetry pendingRetry) {
        this.pendingRetry = pendingRetry;
    }

    void succeed(CallResult outcome) {
        state = outcome.fromCache() ? CallState.CACHE_HIT : CallState.SUCCESS;
        result.complete(outcome);
    }

    void fail(Throwable failure) {
        state = CallState.TERMINAL_FAILURE;
        result.completeExceptionally(failure);
    }

    @Override
    public String toString() {
        return method + " " + target + " [" + id + ", " + state + "]";
    }
}
