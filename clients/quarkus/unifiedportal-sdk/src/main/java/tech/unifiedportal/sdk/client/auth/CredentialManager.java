package tech.unifiedportal.sdk.client.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jboss.logging.Logger;
import tech.unifiedportal.sdk.client.transport.OutgoingCall;
import tech.unifiedportal.sdk.client.transport.PortalTransport;
import tech.unifiedportal.sdk.client.transport.TransportResponse;
import tech.unifiedportal.sdk.enums.HttpMethod;
import tech.unifiedportal.sdk.exception.ApiErrorException;
import tech.unifiedportal.sdk.exception.AuthenticationException;
import tech.unifiedportal.sdk.exception.PortalClientException;
import tech.unifiedportal.sdk.exception.StorageException;
import tech.unifiedportal.sdk.notification.PortalEvent;
import tech.unifiedportal.sdk.notification.PortalEventBus;
import tech.unifiedportal.sdk.storage.DurableStorage;
import tech.unifiedportal.sdk.support.JsonSupport;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holds the bearer credentials and renews them when the remote service rejects a call.
 *
 * <p>Renewal is single-flight: while one renewal call is outstanding, further
 * unauthorized calls are buffered and all of them are released with the renewed
 * token, or rejected together when renewal fails. A failed renewal clears the
 * stored credentials and publishes {@link PortalEvent.AuthenticationFailed}; the
 * hosting application has to authenticate again.
 *
 * <p>The renewal call goes straight to the transport, not through the scheduler,
 * so it cannot queue behind the calls waiting for it.
 */
public class CredentialManager {

    private static final Logger LOG = Logger.getLogger(CredentialManager.class);

    static final String ACCESS_TOKEN_KEY = "access_token";
    static final String REFRESH_TOKEN_KEY = "refresh_token";

    private final DurableStorage storage;
    private final PortalTransport transport;
    private final PortalEventBus eventBus;
    private final ObjectMapper objectMapper;
    private final URI renewalUri;
    private final Duration timeout;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private String accessToken;
    private String refreshToken;
    private boolean renewalInFlight;
    private final List<CompletableFuture<String>> buffered = new ArrayList<>();

    public CredentialManager(DurableStorage storage, PortalTransport transport, PortalEventBus eventBus,
                             ObjectMapper objectMapper, URI renewalUri, Duration timeout, Clock clock) {
        this.storage = storage;
        this.transport = transport;
        this.eventBus = eventBus;
        this.objectMapper = objectMapper;
        this.renewalUri = renewalUri;
        this.timeout = timeout;
        this.clock = clock;
        this.accessToken = load(ACCESS_TOKEN_KEY);
        this.refreshToken = load(REFRESH_TOKEN_KEY);
        if (accessToken != null) {
            LOG.debug("Loaded stored credentials");
        }
    }

    /**
     * Add the current bearer credential to a call. Unauthenticated calls pass through.
     */
    public OutgoingCall attach(OutgoingCall call) {
        String token = currentAccessToken();
        return token == null ? call : call.withHeader("Authorization", "Bearer " + token);
    }

    public String currentAccessToken() {
        lock.lock();
        try {
            return accessToken;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replace the stored credentials, e.g. after login.
     */
    public void setCredentials(String access, String refresh) {
        lock.lock();
        try {
            this.accessToken = access;
            this.refreshToken = refresh;
            persist();
        } finally {
            lock.unlock();
        }
        LOG.info("Credentials updated");
    }

    public void clearCredentials() {
        lock.lock();
        try {
            this.accessToken = null;
            this.refreshToken = null;
            persist();
        } finally {
            lock.unlock();
        }
        LOG.info("Credentials cleared");
    }

    /**
     * Renew the access token. Joins the outstanding renewal if there is one.
     *
     * @return the renewed access token
     */
    public CompletableFuture<String> renew() {
        return bufferOrStart(null);
    }

    /**
     * Obtain a credential to replay a call that was rejected as unauthorized.
     *
     * <p>If the credential was already replaced since the call was sent, the call is
     * replayed with the current one and no renewal is started.
     *
     * @param rejectedToken the token the rejected call carried, or null
     * @return the credential to replay with
     */
    public CompletableFuture<String> renewAfterUnauthorized(String rejectedToken) {
        return bufferOrStart(rejectedToken);
    }

    private CompletableFuture<String> bufferOrStart(String rejectedToken) {
        CompletableFuture<String> waiter = new CompletableFuture<>();
        String refresh;

        lock.lock();
        try {
            if (!renewalInFlight && rejectedToken != null && accessToken != null
                && !Objects.equals(accessToken, rejectedToken)) {
                LOG.debug("Credential already renewed, replaying with current token");
                return CompletableFuture.completedFuture(accessToken);
            }

            buffered.add(waiter);
            if (renewalInFlight) {
                LOG.debugf("Renewal in flight, buffering call (%d waiting)", buffered.size());
                return waiter;
            }
            renewalInFlight = true;
            refresh = refreshToken;
        } finally {
            lock.unlock();
        }

        startRenewal(refresh);
        return waiter;
    }

    private void startRenewal(String refresh) {
        if (refresh == null) {
            onRenewalFailed(AuthenticationException.missingRefreshToken());
            return;
        }

        LOG.info("Renewing credentials");
        OutgoingCall call;
        try {
            ObjectNode body = objectMapper.createObjectNode().put("refresh_token", refresh);
            call = new OutgoingCall(HttpMethod.POST, renewalUri,
                Map.of("Content-Type", "application/json", "Accept", "application/json"),
                objectMapper.writeValueAsString(body), timeout);
        } catch (JsonProcessingException e) {
            onRenewalFailed(AuthenticationException.renewalFailed(e));
            return;
        }

        CompletableFuture<TransportResponse> response;
        try {
            response = transport.send(call);
        } catch (RuntimeException e) {
            onRenewalFailed(AuthenticationException.renewalFailed(e));
            return;
        }

        response.whenComplete((result, failure) -> {
            if (failure != null) {
                onRenewalFailed(AuthenticationException.renewalFailed(PortalClientException.normalize(failure)));
                return;
            }
            JsonNode json = JsonSupport.parseBody(objectMapper, result.body());
            if (result.isError()) {
                onRenewalFailed(AuthenticationException.renewalFailed(
                    ApiErrorException.fromResponse(result.status(), json)));
                return;
            }
            JsonNode newAccess = json.path(ACCESS_TOKEN_KEY);
            if (!newAccess.isTextual() || newAccess.asText().isEmpty()) {
                onRenewalFailed(AuthenticationException.invalidRenewalResponse());
                return;
            }
            JsonNode newRefresh = json.path(REFRESH_TOKEN_KEY);
            onRenewed(new TokenPair(newAccess.asText(), newRefresh.isTextual() ? newRefresh.asText() : refresh));
        });
    }

    /**
     * Store renewed credentials and release every buffered call with the new token.
     */
    public void onRenewed(TokenPair tokens) {
        List<CompletableFuture<String>> waiters;
        lock.lock();
        try {
            this.accessToken = tokens.accessToken();
            this.refreshToken = tokens.refreshToken();
            persist();
            renewalInFlight = false;
            waiters = drainBuffered();
        } finally {
            lock.unlock();
        }

        LOG.infof("Credentials renewed, replaying %d buffered call(s)", waiters.size());
        waiters.forEach(waiter -> waiter.complete(tokens.accessToken()));
    }

    private void onRenewalFailed(AuthenticationException failure) {
        List<CompletableFuture<String>> waiters;
        lock.lock();
        try {
            this.accessToken = null;
            this.refreshToken = null;
            persist();
            renewalInFlight = false;
            waiters = drainBuffered();
        } finally {
            lock.unlock();
        }

        LOG.warnf(failure, "Credential renewal failed, rejecting %d buffered call(s)", waiters.size());
        waiters.forEach(waiter -> waiter.completeExceptionally(failure));
        eventBus.publish(new PortalEvent.AuthenticationFailed(failure.getMessage(), clock.instant()));
    }

    public CredentialState state() {
        lock.lock();
        try {
            return new CredentialState(accessToken != null, refreshToken != null, renewalInFlight, buffered.size());
        } finally {
            lock.unlock();
        }
    }

    private List<CompletableFuture<String>> drainBuffered() {
        List<CompletableFuture<String>> waiters = new ArrayList<>(buffered);
        buffered.clear();
        return waiters;
    }

    private String load(String key) {
        try {
            return storage.read(key).orElse(null);
        } catch (StorageException e) {
            LOG.warnf(e, "Failed to load stored credential [%s]", key);
            return null;
        }
    }

    private void persist() {
        store(ACCESS_TOKEN_KEY, accessToken);
        store(REFRESH_TOKEN_KEY, refreshToken);
    }

    private void store(String key, String value) {
        try {
            if (value == null) {
                storage.remove(key);
            } else {
                storage.write(key, value);
            }
        } catch (StorageException e) {
            LOG.warnf(e, "Failed to persist credential [%s]", key);
        }
    }
}
