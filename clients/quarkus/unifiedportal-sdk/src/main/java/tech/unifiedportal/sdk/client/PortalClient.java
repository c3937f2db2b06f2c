package tech.unifiedportal.sdk.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.unifiedportal.sdk.client.auth.CredentialManager;
import tech.unifiedportal.sdk.client.cache.CacheKeys;
import tech.unifiedportal.sdk.client.cache.ResponseCache;
import tech.unifiedportal.sdk.client.metrics.PerformanceRecorder;
import tech.unifiedportal.sdk.client.retry.RetryPolicy;
import tech.unifiedportal.sdk.client.retry.RetryScheduler;
import tech.unifiedportal.sdk.client.retry.ScheduledRetry;
import tech.unifiedportal.sdk.client.scheduling.PriorityScheduler;
import tech.unifiedportal.sdk.client.transport.OutgoingCall;
import tech.unifiedportal.sdk.client.transport.PortalTransport;
import tech.unifiedportal.sdk.client.transport.TransportResponse;
import tech.unifiedportal.sdk.config.PortalClientConfig;
import tech.unifiedportal.sdk.enums.CacheStrategy;
import tech.unifiedportal.sdk.enums.ErrorType;
import tech.unifiedportal.sdk.enums.HttpMethod;
import tech.unifiedportal.sdk.exception.ApiErrorException;
import tech.unifiedportal.sdk.exception.PortalClientException;
import tech.unifiedportal.sdk.exception.RequestErrorException;
import tech.unifiedportal.sdk.notification.PortalEventBus;
import tech.unifiedportal.sdk.support.JsonSupport;
import tech.unifiedportal.sdk.support.TsidGenerator;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;

/**
 * Single entry point for remote calls to the portal back end.
 *
 * <p>Every call passes through the same pipeline: GET calls are answered from the
 * response cache when possible, everything else is queued on the priority scheduler.
 * Failed attempts are renewed (401), retried with exponential backoff, or surfaced as
 * a {@link PortalClientException}. Callers never see raw transport exceptions.
 *
 * <p>Example usage:
 * <pre>{@code
 * @Inject
 * PortalClient client;
 *
 * client.get("/api/status", null, CallOptions.defaults().withPriority(Priority.CRITICAL))
 *     .thenAccept(result -> render(result.data()));
 *
 * client.post("/api/patients", patient, CallOptions.defaults());
 * }</pre>
 */
@ApplicationScoped
public class PortalClient implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(PortalClient.class);

    private static final int UNAUTHORIZED = 401;
    private static final int CACHE_HIT_STATUS = 200;

    private final PortalClientConfig config;
    private final PortalTransport transport;
    private final ResponseCache cache;
    private final PriorityScheduler scheduler;
    private final CredentialManager credentials;
    private final PerformanceRecorder recorder;
    private final RetryPolicy retryPolicy;
    private final RetryScheduler retryScheduler;
    private final ObjectMapper objectMapper;
    private final PortalEventBus eventBus;
    private final Clock clock;

    private final Set<PendingCall> backingOff = ConcurrentHashMap.newKeySet();
    private volatile boolean closed;

    @Inject
    public PortalClient(PortalClientConfig config, PortalTransport transport, ResponseCache cache,
                        PriorityScheduler scheduler, CredentialManager credentials, PerformanceRecorder recorder,
                        RetryPolicy retryPolicy, RetryScheduler retryScheduler, ObjectMapper objectMapper,
                        PortalEventBus eventBus, Clock clock) {
        this.config = config;
        this.transport = transport;
        this.cache = cache;
        this.scheduler = scheduler;
        this.credentials = credentials;
        this.recorder = recorder;
        this.retryPolicy = retryPolicy;
        this.retryScheduler = retryScheduler;
        this.objectMapper = objectMapper;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    /**
     * Issue a call.
     *
     * @param method HTTP method
     * @param target path relative to the base URL, or an absolute URL
     * @param payload query parameters for GET/HEAD/OPTIONS, JSON body otherwise; may be null
     * @param options per-call options; null means {@link CallOptions#defaults()}
     * @return completes with the result, or exceptionally with a {@link PortalClientException}
     */
    public CompletableFuture<CallResult> call(HttpMethod method, String target, Object payload, CallOptions options) {
        if (closed) {
            return CompletableFuture.failedFuture(RequestErrorException.clientClosed());
        }
        if (method == null) {
            return CompletableFuture.failedFuture(RequestErrorException.missingMethod(target));
        }
        if (target == null || target.isBlank()) {
            return CompletableFuture.failedFuture(RequestErrorException.invalidTarget(target, null));
        }
        CallOptions effective = options != null ? options : CallOptions.defaults();

        JsonNode params;
        try {
            params = payload == null ? null : objectMapper.valueToTree(payload);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(RequestErrorException.unserializablePayload(e));
        }
        if (!method.allowsBody() && params != null && !params.isNull() && !params.isObject()) {
            return CompletableFuture.failedFuture(RequestErrorException.invalidQueryParams(method, params));
        }

        PendingCall pending = new PendingCall(method, target, params,
            effective, CacheKeys.derive(objectMapper, target, params, effective.headers()));

        if (method == HttpMethod.GET && !effective.bypassCache()
            && effective.cacheStrategy() != CacheStrategy.NO_CACHE) {
            pending.transition(CallState.CACHE_CHECK);
            Optional<JsonNode> cached = cache.get(pending.cacheKey(), effective.cacheStrategy());
            if (cached.isPresent()) {
                LOG.debugf("Cache hit for %s", pending);
                pending.succeed(new CallResult(cached.get(), true, CACHE_HIT_STATUS));
                return pending.result();
            }
        }

        submit(pending);
        return pending.result();
    }

    public CompletableFuture<CallResult> get(String target, Object params, CallOptions options) {
        return call(HttpMethod.GET, target, params, options);
    }

    public CompletableFuture<CallResult> get(String target) {
        return call(HttpMethod.GET, target, null, null);
    }

    public CompletableFuture<CallResult> post(String target, Object body, CallOptions options) {
        return call(HttpMethod.POST, target, body, options);
    }

    public CompletableFuture<CallResult> put(String target, Object body, CallOptions options) {
        return call(HttpMethod.PUT, target, body, options);
    }

    public CompletableFuture<CallResult> patch(String target, Object body, CallOptions options) {
        return call(HttpMethod.PATCH, target, body, options);
    }

    public CompletableFuture<CallResult> delete(String target, CallOptions options) {
        return call(HttpMethod.DELETE, target, null, options);
    }

    /**
     * Issue a call and map the response payload to a type.
     */
    public <T> CompletableFuture<T> request(HttpMethod method, String target, Object payload,
                                            CallOptions options, TypeReference<T> responseType) {
        return call(method, target, payload, options).thenApply(result -> {
            if (!JsonSupport.hasContent(result.data())) {
                return null;
            }
            try {
                return objectMapper.convertValue(result.data(), responseType);
            } catch (IllegalArgumentException e) {
                throw new PortalClientException(ErrorType.API_ERROR, "Failed to map response body",
                    result.status(), result.data(), null, e);
            }
        });
    }

    private void submit(PendingCall pending) {
        if (closed) {
            pending.fail(RequestErrorException.clientClosed());
            return;
        }
        pending.transition(CallState.QUEUED);
        scheduler.enqueue(() -> attempt(pending), pending.options().priority())
            .whenComplete((attempt, failure) -> {
                if (failure != null) {
                    fail(pending, failure instanceof RejectedExecutionException
                        ? RequestErrorException.clientClosed()
                        : PortalClientException.normalize(failure));
                } else {
                    onAttemptCompleted(pending, attempt);
                }
            });
    }

    private CompletableFuture<Attempt> attempt(PendingCall pending) {
        pending.transition(CallState.EXECUTING);
        Instant startedAt = clock.instant();
        OutgoingCall call = buildCall(pending);
        LOG.debugf("Executing %s (attempt %d)", pending, pending.retryCount() + 1);
        return transport.send(call)
            .handle((response, failure) -> new Attempt(call, startedAt, response, failure));
    }

    private void onAttemptCompleted(PendingCall pending, Attempt attempt) {
        if (attempt.failure() != null) {
            recorder.record(attempt.startedAt(), false, 0);
            retryOrFail(pending, PortalClientException.normalize(attempt.failure()));
            return;
        }

        TransportResponse response = attempt.response();
        JsonNode body = JsonSupport.parseBody(objectMapper, response.body());

        if (!response.isError()) {
            recorder.record(attempt.startedAt(), true, response.status());
            storeInCache(pending, body);
            pending.succeed(new CallResult(body, false, response.status()));
            return;
        }

        recorder.record(attempt.startedAt(), false, response.status());
        if (response.status() == UNAUTHORIZED && !pending.retriedAfterRenewal()) {
            renewAndReplay(pending, attempt.call().bearerToken());
            return;
        }
        retryOrFail(pending, ApiErrorException.fromResponse(response.status(), body));
    }

    private void storeInCache(PendingCall pending, JsonNode body) {
        CallOptions options = pending.options();
        if (pending.method() != HttpMethod.GET || options.cacheStrategy() == CacheStrategy.NO_CACHE
            || !JsonSupport.hasContent(body)) {
            return;
        }
        cache.set(pending.cacheKey(), body, cacheTtlFor(options), options.cacheStrategy());
    }

    private void renewAndReplay(PendingCall pending, String rejectedToken) {
        pending.transition(CallState.AUTH_EXPIRED);
        pending.markRetriedAfterRenewal();
        LOG.debugf("Unauthorized response for %s, awaiting credential renewal", pending);

        credentials.renewAfterUnauthorized(rejectedToken).whenComplete((token, failure) -> {
            if (failure != null) {
                fail(pending, PortalClientException.normalize(failure));
                return;
            }
            pending.transition(CallState.RETRY);
            submit(pending);
        });
    }

    private void retryOrFail(PendingCall pending, PortalClientException error) {
        if (closed || !retryPolicy.shouldRetry(pending.method(), pending.options().retryWrites(),
            error, pending.retryCount())) {
            fail(pending, error);
            return;
        }

        Duration delay = retryPolicy.delayFor(pending.retryCount());
        pending.incrementRetryCount();
        pending.transition(CallState.BACKOFF);
        LOG.debugf("Retrying %s in %dms (retry %d/%d): %s", pending, delay.toMillis(),
            pending.retryCount(), retryPolicy.maxAttempts(), error.getMessage());

        backingOff.add(pending);
        ScheduledRetry retry;
        try {
            retry = retryScheduler.schedule(delay, () -> {
                backingOff.remove(pending);
                pending.transition(CallState.RETRY);
                submit(pending);
            });
        } catch (RejectedExecutionException e) {
            backingOff.remove(pending);
            fail(pending, RequestErrorException.clientClosed());
            return;
        }
        pending.setPendingRetry(retry);

        // close() may have swept backingOff before this retry was registered
        if (closed && retry.cancel()) {
            backingOff.remove(pending);
            fail(pending, RequestErrorException.clientClosed());
        }
    }

    private void fail(PendingCall pending, PortalClientException error) {
        if (error.getType() == ErrorType.API_ERROR && error.getStatusCode() < 500) {
            LOG.debugf("%s failed: %s", pending, error.getMessage());
        } else {
            LOG.warnf("%s failed after %d retries: %s %s", pending, pending.retryCount(),
                error.getType(), error.getMessage());
        }
        pending.fail(error);
    }

    private OutgoingCall buildCall(PendingCall pending) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Type", "application/json");
        headers.put("Accept", "application/json");
        headers.put("X-Client", config.clientName());
        headers.put("X-Version", config.clientVersion());
        headers.put("Accept-Language", config.acceptLanguage());
        headers.put("X-Request-Id", TsidGenerator.requestId());
        headers.putAll(pending.options().headers());

        String body = null;
        URI uri;
        if (pending.method().allowsBody()) {
            uri = resolve(pending.target(), null);
            body = serialize(pending.payload());
        } else {
            uri = resolve(pending.target(), pending.payload());
        }

        Duration timeout = pending.options().timeout() != null
            ? pending.options().timeout()
            : Duration.ofSeconds(config.http().timeout());

        return credentials.attach(new OutgoingCall(pending.method(), uri, headers, body, timeout));
    }

    private URI resolve(String target, JsonNode queryParams) {
        String url;
        if (target.startsWith("http://") || target.startsWith("https://")) {
            url = target;
        } else {
            String base = config.baseUrl().replaceAll("/$", "");
            url = base + (target.startsWith("/") ? target : "/" + target);
        }

        String query = toQueryString(queryParams);
        if (!query.isEmpty()) {
            url = url + (url.contains("?") ? "&" : "?") + query;
        }

        try {
            return URI.create(url);
        } catch (IllegalArgumentException e) {
            throw RequestErrorException.invalidTarget(target, e);
        }
    }

    private static String toQueryString(JsonNode params) {
        if (params == null || !params.isObject()) {
            return "";
        }
        StringJoiner query = new StringJoiner("&");
        Iterator<Map.Entry<String, JsonNode>> fields = params.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value.isNull()) {
                continue;
            }
            if (value.isArray()) {
                value.forEach(element -> query.add(encode(field.getKey()) + "=" + encode(asQueryValue(element))));
            } else {
                query.add(encode(field.getKey()) + "=" + encode(asQueryValue(value)));
            }
        }
        return query.toString();
    }

    private static String asQueryValue(JsonNode value) {
        return value.isValueNode() ? value.asText() : value.toString();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private String serialize(JsonNode payload) {
        if (payload == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw RequestErrorException.unserializablePayload(e);
        }
    }

    private Duration cacheTtlFor(CallOptions options) {
        if (options.cacheTtl() != null) {
            return options.cacheTtl();
        }
        return Duration.ofMillis(options.isReferenceData()
            ? config.cache().referenceTtl()
            : config.cache().ttl());
    }

    public void setCredentials(String accessToken, String refreshToken) {
        credentials.setCredentials(accessToken, refreshToken);
    }

    public void clearCredentials() {
        credentials.clearCredentials();
    }

    public ClientMetrics getMetrics() {
        return new ClientMetrics(recorder.snapshot(), cache.stats(), scheduler.stats());
    }

    public void clearCache() {
        cache.clear();
    }

    /**
     * Drop the cached response for a GET call issued with the given target and
     * parameters and no per-call headers.
     */
    public void invalidate(String target, Object params) {
        JsonNode node = params == null ? null : objectMapper.valueToTree(params);
        cache.delete(CacheKeys.derive(objectMapper, target, node, Map.of()));
    }

    public void resetMetrics() {
        recorder.reset();
    }

    public PortalEventBus events() {
        return eventBus;
    }

    /**
     * Stop accepting calls. Calls waiting in backoff or in the queue fail with
     * REQUEST_ERROR; calls already on the wire complete normally.
     */
    @Override
    @PreDestroy
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        int cancelled = 0;
        for (PendingCall pending : backingOff) {
            ScheduledRetry retry = pending.pendingRetry();
            if (retry == null || retry.cancel()) {
                backingOff.remove(pending);
                pending.fail(RequestErrorException.clientClosed());
                cancelled++;
            }
        }
        retryScheduler.shutdown();
        scheduler.shutdown();
        LOG.infof("Portal client closed, %d pending retr%s cancelled", cancelled, cancelled == 1 ? "y" : "ies");
    }

    private record Attempt(OutgoingCall call, Instant startedAt, TransportResponse response, Throwable failure) {}
}
