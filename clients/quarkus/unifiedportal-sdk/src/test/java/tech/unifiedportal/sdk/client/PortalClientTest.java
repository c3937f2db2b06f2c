package tech.unifiedportal.sdk.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tech.unifiedportal.sdk.client.auth.CredentialManager;
import tech.unifiedportal.sdk.client.cache.ResponseCache;
import tech.unifiedportal.sdk.client.metrics.PerformanceRecorder;
import tech.unifiedportal.sdk.client.retry.ExecutorRetryScheduler;
import tech.unifiedportal.sdk.client.retry.RetryPolicy;
import tech.unifiedportal.sdk.client.retry.RetryScheduler;
import tech.unifiedportal.sdk.client.scheduling.PriorityScheduler;
import tech.unifiedportal.sdk.client.transport.OutgoingCall;
import tech.unifiedportal.sdk.client.transport.TransportResponse;
import tech.unifiedportal.sdk.config.PortalClientConfig;
import tech.unifiedportal.sdk.enums.CacheStrategy;
import tech.unifiedportal.sdk.enums.ErrorType;
import tech.unifiedportal.sdk.enums.HttpMethod;
import tech.unifiedportal.sdk.enums.Priority;
import tech.unifiedportal.sdk.exception.ApiErrorException;
import tech.unifiedportal.sdk.exception.AuthenticationException;
import tech.unifiedportal.sdk.exception.NetworkErrorException;
import tech.unifiedportal.sdk.exception.PortalClientException;
import tech.unifiedportal.sdk.notification.PortalEvent;
import tech.unifiedportal.sdk.notification.PortalEventBus;
import tech.unifiedportal.sdk.storage.InMemoryDurableStorage;
import tech.unifiedportal.sdk.support.JsonSupport;
import tech.unifiedportal.sdk.testing.FakeTransport;
import tech.unifiedportal.sdk.testing.MutableClock;
import tech.unifiedportal.sdk.testing.RecordingRetryScheduler;
import tech.unifiedportal.sdk.testing.TestConfigs;

import java.net.ConnectException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Pure unit tests for PortalClient - no container needed.
 * The transport is scripted and backoff delays are recorded instead of waited for.
 */
class PortalClientTest {

    private static final String BASE_URL = "http://portal.test";
    private static final String REFRESH_PATH = "/api/auth/refresh";

    private ObjectMapper objectMapper;
    private MutableClock clock;
    private InMemoryDurableStorage storage;
    private FakeTransport transport;
    private RecordingRetryScheduler retryScheduler;
    private PortalEventBus eventBus;
    private PriorityScheduler scheduler;
    private PortalClient client;

    @BeforeEach
    void setUp() {
        objectMapper = JsonSupport.newObjectMapper();
        clock = MutableClock.startingAt("2026-01-15T08:00:00Z");
        storage = new InMemoryDurableStorage();
        transport = new FakeTransport();
        retryScheduler = new RecordingRetryScheduler();
        eventBus = new PortalEventBus();
        client = newClient(5);
    }

    @AfterEach
    void tearDown() {
        client.close();
    }

    private PortalClient newClient(int maxConcurrent) {
        return newClient(maxConcurrent, retryScheduler);
    }

    private PortalClient newClient(int maxConcurrent, RetryScheduler retries) {
        PortalClientConfig config = TestConfigs.portalConfig(Map.of(
            "unifiedportal.base-url", BASE_URL,
            "unifiedportal.scheduler.max-concurrent", String.valueOf(maxConcurrent)));
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        scheduler = new PriorityScheduler(maxConcurrent, meterRegistry, clock);
        CredentialManager credentials = new CredentialManager(storage, transport, eventBus, objectMapper,
            URI.create(BASE_URL + REFRESH_PATH), Duration.ofSeconds(30), clock);
        return new PortalClient(config, transport,
            new ResponseCache(storage, objectMapper, config.cache().capacity(), clock),
            scheduler, credentials, new PerformanceRecorder(meterRegistry, clock),
            new RetryPolicy(config.http().retryAttempts(), config.http().retryDelay()),
            retries, objectMapper, eventBus, clock);
    }

    private static PortalClientException failureOf(CompletableFuture<?> future) {
        ExecutionException error = assertThrows(ExecutionException.class, () -> future.get(2, TimeUnit.SECONDS));
        return assertInstanceOf(PortalClientException.class, error.getCause());
    }

    @Test
    void shouldServeSecondReadFromCache() throws Exception {
        // Given
        transport.respond("/api/patients", 200, "{\"items\":[1,2]}");

        // When
        CallResult first = client.get("/api/patients", Map.of("ward", "A"), CallOptions.defaults()).get();
        CallResult second = client.get("/api/patients", Map.of("ward", "A"), CallOptions.defaults()).get();

        // Then
        assertFalse(first.fromCache());
        assertTrue(second.fromCache());
        assertEquals(2, second.data().get("items").size());
        assertEquals(1, transport.sentTo("/api/patients").size());
        assertEquals(1, client.getMetrics().cache().hits());
    }

    @Test
    void shouldSkipCacheLookupWhenBypassedButRefreshEntry() throws Exception {
        transport.respond("/api/beds", 200, "{\"free\":1}");
        transport.respond("/api/beds", 200, "{\"free\":2}");
        client.get("/api/beds", null, CallOptions.defaults()).get();

        CallResult bypassed = client.get("/api/beds", null, CallOptions.defaults().withBypassCache(true)).get();
        CallResult cached = client.get("/api/beds", null, CallOptions.defaults()).get();

        assertFalse(bypassed.fromCache());
        assertEquals(2, cached.data().get("free").asInt());
        assertTrue(cached.fromCache());
    }

    @Test
    void shouldNeverCacheWrites() throws Exception {
        transport.respond("/api/patients", 201, "{\"id\":9}");
        transport.respond("/api/patients", 201, "{\"id\":10}");

        client.post("/api/patients", Map.of("name", "A"), CallOptions.defaults()).get();
        CallResult second = client.post("/api/patients", Map.of("name", "A"), CallOptions.defaults()).get();

        assertFalse(second.fromCache());
        assertEquals(10, second.data().get("id").asInt());
        assertEquals(0, client.getMetrics().cache().volatileSize());
    }

    @Test
    void shouldCompleteCriticalBeforeBackgroundWithSingleSlot() {
        // Given
        client.close();
        client = newClient(1);
        CompletableFuture<TransportResponse> blocker = transport.hold("/api/blocker");
        transport.respond("/reports", 200, "{\"rows\":[]}");
        transport.respond("/status", 200, "{\"ok\":true}");
        List<String> completed = new CopyOnWriteArrayList<>();

        client.get("/api/blocker", null, CallOptions.defaults().withCacheStrategy(CacheStrategy.NO_CACHE));
        CompletableFuture<CallResult> reports = client.get("/reports", null,
            CallOptions.defaults().withPriority(Priority.BACKGROUND));
        CompletableFuture<CallResult> status = client.get("/status", null,
            CallOptions.defaults().withPriority(Priority.CRITICAL));
        reports.thenRun(() -> completed.add("/reports"));
        status.thenRun(() -> completed.add("/status"));

        // When
        blocker.complete(TransportResponse.of(200, "{}"));

        // Then
        await().atMost(2, TimeUnit.SECONDS).until(() -> completed.size() == 2);
        assertEquals(List.of("/status", "/reports"), completed);
    }

    @Test
    void shouldRetryServerErrorsWithExponentialBackoff() {
        // Given
        transport.byDefault("/api/flaky", call -> CompletableFuture.completedFuture(TransportResponse.of(503, "")));

        // When
        PortalClientException error = failureOf(client.get("/api/flaky", null, CallOptions.defaults()));

        // Then
        assertInstanceOf(ApiErrorException.class, error);
        assertEquals(503, error.getStatusCode());
        assertEquals(List.of(1000L, 2000L, 4000L), retryScheduler.delaysInMillis());
        assertEquals(4, transport.sentTo("/api/flaky").size());
        assertEquals(4, client.getMetrics().calls().serverErrors());
    }

    @Test
    void shouldSucceedWhenRetryRecovers() throws Exception {
        transport.respond("/api/flaky", 502, "");
        transport.respond("/api/flaky", 200, "{\"ok\":true}");

        CallResult result = client.get("/api/flaky", null, CallOptions.defaults()).get(2, TimeUnit.SECONDS);

        assertTrue(result.data().get("ok").asBoolean());
        assertEquals(List.of(1000L), retryScheduler.delaysInMillis());
    }

    @Test
    void shouldNotRetryNotFound() {
        transport.respond("/api/patients/404", 404, "{\"message\":\"Patient not found\",\"code\":\"PATIENT_NOT_FOUND\"}");

        PortalClientException error = failureOf(client.get("/api/patients/404"));

        assertEquals(ErrorType.API_ERROR, error.getType());
        assertEquals("Patient not found", error.getMessage());
        assertEquals("PATIENT_NOT_FOUND", error.getErrorCode());
        assertEquals(1, transport.sentTo("/api/patients/404").size());
        assertTrue(retryScheduler.delays().isEmpty());
    }

    @Test
    void shouldRetryWritesOnlyWhenOptedIn() {
        transport.byDefault("/api/orders", call -> CompletableFuture.completedFuture(TransportResponse.of(503, "")));

        failureOf(client.post("/api/orders", Map.of("item", 1), CallOptions.defaults()));
        assertEquals(1, transport.sentTo("/api/orders").size());

        failureOf(client.post("/api/orders", Map.of("item", 1), CallOptions.defaults().withRetryWrites(true)));
        assertEquals(5, transport.sentTo("/api/orders").size());
    }

    @Test
    void shouldSurfaceNetworkErrorsAfterRetries() {
        transport.byDefault("/api/down", call -> CompletableFuture.failedFuture(new ConnectException("refused")));

        PortalClientException error = failureOf(client.get("/api/down"));

        assertInstanceOf(NetworkErrorException.class, error);
        assertEquals(0, error.getStatusCode());
        assertEquals(4, transport.sentTo("/api/down").size());
        assertEquals(4, client.getMetrics().calls().networkErrors());
    }

    @Test
    void shouldRejectUnserializablePayloadWithoutSending() {
        Object unserializable = new Object() {
            public Object getSelf() {
                return this;
            }
        };

        PortalClientException error = failureOf(client.post("/api/x", unserializable, CallOptions.defaults()));

        assertEquals(ErrorType.REQUEST_ERROR, error.getType());
        assertTrue(transport.sent().isEmpty());
    }

    @Test
    void shouldRejectInvalidTargetAsRequestError() {
        PortalClientException error = failureOf(client.get("/api/bad path|with^chars"));

        assertEquals(ErrorType.REQUEST_ERROR, error.getType());
        assertTrue(transport.sent().isEmpty());
        assertTrue(retryScheduler.delays().isEmpty());
    }

    @Test
    void shouldRejectMissingTargetOrMethodAsRequestError() {
        CompletableFuture<CallResult> nullTarget = assertDoesNotThrow(() -> client.get(null));
        CompletableFuture<CallResult> blankTarget = client.post("  ", Map.of("a", 1), CallOptions.defaults());
        CompletableFuture<CallResult> nullMethod = client.call(null, "/api/patients", null, null);

        assertEquals(ErrorType.REQUEST_ERROR, failureOf(nullTarget).getType());
        assertEquals(ErrorType.REQUEST_ERROR, failureOf(blankTarget).getType());
        assertEquals(ErrorType.REQUEST_ERROR, failureOf(nullMethod).getType());
        assertTrue(transport.sent().isEmpty());
    }

    @Test
    void shouldRejectNonObjectQueryParameters() {
        PortalClientException listParams = failureOf(client.get("/api/patients", List.of(1, 2), CallOptions.defaults()));
        PortalClientException scalarParams = failureOf(client.get("/api/patients", "ward=A", CallOptions.defaults()));

        assertEquals(ErrorType.REQUEST_ERROR, listParams.getType());
        assertEquals(ErrorType.REQUEST_ERROR, scalarParams.getType());
        assertTrue(transport.sent().isEmpty());
        assertEquals(0, client.getMetrics().cache().misses());
    }

    @Test
    void shouldRenewOnceAndReplayConcurrentUnauthorizedCalls() throws Exception {
        // Given
        client.setCredentials("old-access", "refresh-1");
        CompletableFuture<TransportResponse> renewal = transport.hold(REFRESH_PATH);
        transport.byDefault("/api/vitals", call -> CompletableFuture.completedFuture(
            "new-access".equals(call.bearerToken())
                ? TransportResponse.of(200, "{\"ok\":true}")
                : TransportResponse.of(401, "{\"message\":\"token expired\"}")));

        // When
        List<CompletableFuture<CallResult>> calls = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            calls.add(client.get("/api/vitals", Map.of("bed", i), CallOptions.defaults()));
        }
        assertEquals(1, transport.sentTo(REFRESH_PATH).size());
        calls.forEach(call -> assertFalse(call.isDone()));
        renewal.complete(TransportResponse.of(200, "{\"access_token\":\"new-access\",\"refresh_token\":\"refresh-2\"}"));

        // Then
        for (CompletableFuture<CallResult> call : calls) {
            assertTrue(call.get(2, TimeUnit.SECONDS).data().get("ok").asBoolean());
        }
        assertEquals(1, transport.sentTo(REFRESH_PATH).size());
        List<OutgoingCall> vitals = transport.sentTo("/api/vitals");
        assertEquals(10, vitals.size());
        assertEquals(5, vitals.stream().filter(call -> "new-access".equals(call.bearerToken())).count());
        assertTrue(retryScheduler.delays().isEmpty(), "buffered calls are not retried independently");
    }

    @Test
    void shouldFailWithAuthFailureWhenRenewalFails() {
        // Given
        List<PortalEvent.AuthenticationFailed> signals = new CopyOnWriteArrayList<>();
        client.events().subscribe(PortalEvent.AuthenticationFailed.class, signals::add);
        client.setCredentials("old-access", "revoked");
        transport.respond(REFRESH_PATH, 401, "{\"message\":\"refresh token revoked\"}");
        transport.respond("/api/profile", 401, "");

        // When
        PortalClientException error = failureOf(client.get("/api/profile"));

        // Then
        assertInstanceOf(AuthenticationException.class, error);
        assertEquals(ErrorType.AUTH_FAILURE, error.getType());
        assertEquals(1, signals.size());
        assertTrue(storage.read("access_token").isEmpty());
    }

    @Test
    void shouldTreatUnauthorizedAfterRenewalAsTerminal() {
        client.setCredentials("old-access", "refresh-1");
        transport.respond(REFRESH_PATH, 200, "{\"access_token\":\"new-access\"}");
        transport.byDefault("/api/admin", call -> CompletableFuture.completedFuture(TransportResponse.of(401, "")));

        PortalClientException error = failureOf(client.get("/api/admin"));

        assertEquals(ErrorType.API_ERROR, error.getType());
        assertEquals(401, error.getStatusCode());
        assertEquals(2, transport.sentTo("/api/admin").size());
        assertEquals(1, transport.sentTo(REFRESH_PATH).size());
    }

    @Test
    void shouldSendDefaultHeadersQueryAndCredential() throws Exception {
        client.setCredentials("abc", "def");

        client.get("/api/patients", Map.of("ward", "ICU", "ids", List.of(1, 2)),
            CallOptions.defaults().withHeader("X-Tenant", "riyadh")).get();

        OutgoingCall sent = transport.sentTo("/api/patients").get(0);
        assertEquals("UnifiedPortal-Frontend", sent.headers().get("X-Client"));
        assertEquals("1.0.0", sent.headers().get("X-Version"));
        assertEquals("ar-SA,ar;q=0.9,en;q=0.8", sent.headers().get("Accept-Language"));
        assertTrue(sent.headers().get("X-Request-Id").startsWith("req_"));
        assertEquals("riyadh", sent.headers().get("X-Tenant"));
        assertEquals("abc", sent.bearerToken());
        assertEquals("portal.test", sent.uri().getHost());
        assertTrue(sent.uri().getQuery().contains("ward=ICU"));
        assertTrue(sent.uri().getQuery().contains("ids=1"));
        assertTrue(sent.uri().getQuery().contains("ids=2"));
        assertNull(sent.body());
        assertEquals(Duration.ofSeconds(30), sent.timeout());
    }

    @Test
    void shouldSendJsonBodyForWrites() throws Exception {
        client.put("/api/patients/7", Map.of("name", "Layla"),
            CallOptions.defaults().withTimeout(Duration.ofSeconds(5))).get();

        OutgoingCall sent = transport.sentTo("/api/patients/7").get(0);
        assertEquals(HttpMethod.PUT, sent.method());
        assertEquals("Layla", objectMapper.readTree(sent.body()).get("name").asText());
        assertNull(sent.uri().getQuery());
        assertEquals(Duration.ofSeconds(5), sent.timeout());
    }

    @Test
    void shouldUseReferenceTtlForReferenceData() throws Exception {
        transport.respond("/api/codes", 200, "{\"codes\":[\"A00\"]}");
        client.get("/api/codes", null, CallOptions.referenceData()).get();

        clock.advance(Duration.ofMinutes(30));
        assertTrue(client.get("/api/codes", null, CallOptions.referenceData()).get().fromCache());

        clock.advance(Duration.ofMinutes(31));
        assertFalse(client.get("/api/codes", null, CallOptions.referenceData()).get().fromCache());
    }

    @Test
    void shouldMapTypedResponses() throws Exception {
        transport.respond("/api/wards", 200, "[{\"name\":\"ICU\"},{\"name\":\"ER\"}]");

        List<Map<String, String>> wards = client.request(HttpMethod.GET, "/api/wards", null,
            CallOptions.defaults(), new TypeReference<List<Map<String, String>>>() {}).get();

        assertEquals(2, wards.size());
        assertEquals("ER", wards.get(1).get("name"));
    }

    @Test
    void shouldInvalidateCachedCall() throws Exception {
        transport.respond("/api/patients", 200, "{\"v\":1}");
        transport.respond("/api/patients", 200, "{\"v\":2}");
        client.get("/api/patients", Map.of("ward", "A"), CallOptions.defaults()).get();

        client.invalidate("/api/patients", Map.of("ward", "A"));

        CallResult refreshed = client.get("/api/patients", Map.of("ward", "A"), CallOptions.defaults()).get();
        assertFalse(refreshed.fromCache());
        assertEquals(2, refreshed.data().get("v").asInt());
    }

    @Test
    void shouldFailPendingRetriesOnClose() {
        // Given
        retryScheduler.pause();
        transport.respond("/api/slow", 503, "");
        CompletableFuture<CallResult> call = client.get("/api/slow");
        assertFalse(call.isDone());

        // When
        client.close();

        // Then
        PortalClientException error = failureOf(call);
        assertEquals(ErrorType.REQUEST_ERROR, error.getType());
        retryScheduler.runPending();
        assertEquals(1, transport.sentTo("/api/slow").size());
        assertEquals(ErrorType.REQUEST_ERROR, failureOf(client.get("/api/after-close")).getType());
    }

    @Test
    void shouldFailRetriableCallWhenRetrySchedulerIsAlreadyShutDown() {
        // Given - the retry timer is released before the client, as a container may do on shutdown
        ExecutorRetryScheduler released = new ExecutorRetryScheduler();
        released.shutdown();
        PortalClient orphaned = newClient(5, released);
        transport.respond("/api/flaky", 503, "");

        try {
            // When
            CompletableFuture<CallResult> call = orphaned.get("/api/flaky");

            // Then
            await().atMost(3, TimeUnit.SECONDS).until(call::isDone);
            assertEquals(ErrorType.REQUEST_ERROR, failureOf(call).getType());
            assertEquals(1, transport.sentTo("/api/flaky").size());
        } finally {
            orphaned.close();
        }
    }

    @Test
    void shouldCloseThroughContainerLifecycle() throws Exception {
        assertNotNull(PortalClient.class.getMethod("close").getAnnotation(PreDestroy.class));
    }

    @Test
    void shouldExposeAndResetMetrics() throws Exception {
        transport.respond("/api/ok", 200, "{}");
        transport.respond("/api/missing", 404, "");
        client.get("/api/ok", null, CallOptions.defaults().withCacheStrategy(CacheStrategy.NO_CACHE)).get();
        failureOf(client.get("/api/missing"));

        ClientMetrics metrics = client.getMetrics();
        assertEquals(2, metrics.calls().totalCalls());
        assertEquals(1, metrics.calls().clientErrors());
        assertEquals(50.0, metrics.calls().successRate(), 0.001);
        assertEquals(0, metrics.queue().activeCount());
        assertEquals(5, metrics.queue().maxConcurrent());

        client.resetMetrics();
        assertEquals(0, client.getMetrics().calls().totalCalls());
    }
}
