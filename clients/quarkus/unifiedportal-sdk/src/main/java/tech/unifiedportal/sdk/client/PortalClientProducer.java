package tech.unifiedportal.sdk.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;
import tech.unifiedportal.sdk.client.auth.CredentialManager;
import tech.unifiedportal.sdk.client.cache.ResponseCache;
import tech.unifiedportal.sdk.client.metrics.PerformanceRecorder;
import tech.unifiedportal.sdk.client.retry.ExecutorRetryScheduler;
import tech.unifiedportal.sdk.client.retry.RetryPolicy;
import tech.unifiedportal.sdk.client.retry.RetryScheduler;
import tech.unifiedportal.sdk.client.scheduling.PriorityScheduler;
import tech.unifiedportal.sdk.client.transport.JdkHttpTransport;
import tech.unifiedportal.sdk.client.transport.PortalTransport;
import tech.unifiedportal.sdk.config.PortalClientConfig;
import tech.unifiedportal.sdk.notification.JdkWebSocketChannel;
import tech.unifiedportal.sdk.notification.NotificationChannel;
import tech.unifiedportal.sdk.notification.NotificationService;
import tech.unifiedportal.sdk.notification.PortalEventBus;
import tech.unifiedportal.sdk.storage.DurableStorage;
import tech.unifiedportal.sdk.storage.FileDurableStorage;
import tech.unifiedportal.sdk.storage.InMemoryDurableStorage;
import tech.unifiedportal.sdk.support.JsonSupport;

import java.net.URI;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * CDI producer that wires the client's components from {@link PortalClientConfig}.
 */
@ApplicationScoped
public class PortalClientProducer {

    private static final Logger LOG = Logger.getLogger(PortalClientProducer.class);

    @Inject
    PortalClientConfig config;

    @Produces
    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Produces
    @Singleton
    public ObjectMapper objectMapper() {
        return JsonSupport.newObjectMapper();
    }

    @Produces
    @Singleton
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Produces
    @Singleton
    public PortalEventBus eventBus() {
        return new PortalEventBus();
    }

    @Produces
    @Singleton
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(config.http().timeout()))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    }

    @Produces
    @Singleton
    public DurableStorage durableStorage() {
        return config.storage().directory()
            .<DurableStorage>map(dir -> new FileDurableStorage(Path.of(dir)))
            .orElseGet(() -> {
                LOG.info("No storage directory configured, durable entries are kept in memory");
                return new InMemoryDurableStorage();
            });
    }

    @Produces
    @Singleton
    public PortalTransport transport(HttpClient httpClient) {
        return new JdkHttpTransport(httpClient);
    }

    @Produces
    @Singleton
    public ResponseCache responseCache(DurableStorage storage, ObjectMapper objectMapper, Clock clock) {
        return new ResponseCache(storage, objectMapper, config.cache().capacity(), clock);
    }

    @Produces
    @Singleton
    public PriorityScheduler priorityScheduler(MeterRegistry meterRegistry, Clock clock) {
        return new PriorityScheduler(config.scheduler().maxConcurrent(), meterRegistry, clock);
    }

    public void shutdownScheduler(@Disposes PriorityScheduler scheduler) {
        scheduler.shutdown();
    }

    @Produces
    @Singleton
    public PerformanceRecorder performanceRecorder(MeterRegistry meterRegistry, Clock clock) {
        return new PerformanceRecorder(meterRegistry, clock);
    }

    @Produces
    @Singleton
    public CredentialManager credentialManager(DurableStorage storage, PortalTransport transport,
                                               PortalEventBus eventBus, ObjectMapper objectMapper, Clock clock) {
        URI renewalUri = URI.create(config.baseUrl().replaceAll("/$", "") + config.auth().refreshPath());
        return new CredentialManager(storage, transport, eventBus, objectMapper, renewalUri,
            Duration.ofSeconds(config.http().timeout()), clock);
    }

    @Produces
    @Singleton
    public RetryPolicy retryPolicy() {
        return new RetryPolicy(config.http().retryAttempts(), config.http().retryDelay());
    }

    @Produces
    @Singleton
    public RetryScheduler retryScheduler() {
        return new ExecutorRetryScheduler();
    }

    public void shutdownRetryScheduler(@Disposes RetryScheduler retryScheduler) {
        retryScheduler.shutdown();
    }

    @Produces
    @Singleton
    public NotificationChannel notificationChannel(HttpClient httpClient) {
        return new JdkWebSocketChannel(httpClient, config.notifications().wsUrl());
    }

    @Produces
    @Singleton
    public NotificationService notificationService(NotificationChannel channel, PortalEventBus eventBus,
                                                   ObjectMapper objectMapper) {
        return new NotificationService(channel, eventBus, objectMapper);
    }

    public void closeNotifications(@Disposes NotificationService notificationService) {
        notificationService.close();
    }
}
