package tech.unifiedportal.sdk.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.Optional;

/**
 * Configuration for the unified portal client.
 *
 * <p>Configure in application.properties:
 * <pre>
 * unifiedportal.base-url=https://portal.example.org
 * unifiedportal.http.timeout=30
 * unifiedportal.cache.capacity=100
 * unifiedportal.scheduler.max-concurrent=5
 * unifiedportal.storage.directory=/var/lib/portal-client
 * </pre>
 */
@ConfigMapping(prefix = "unifiedportal")
public interface PortalClientConfig {

    /**
     * Base URL of the remote service. Relative call targets are resolved against it.
     */
    @WithName("base-url")
    @WithDefault("http://localhost:8000")
    String baseUrl();

    /**
     * Sent as X-Client on every call.
     */
    @WithName("client-name")
    @WithDefault("UnifiedPortal-Frontend")
    String clientName();

    /**
     * Sent as X-Version on every call.
     */
    @WithName("client-version")
    @WithDefault("1.0.0")
    String clientVersion();

    /**
     * Default Accept-Language header.
     */
    @WithName("accept-language")
    @WithDefault("ar-SA,ar;q=0.9,en;q=0.8")
    String acceptLanguage();

    /**
     * HTTP call configuration.
     */
    HttpConfig http();

    /**
     * Response cache configuration.
     */
    CacheConfig cache();

    /**
     * Priority scheduler configuration.
     */
    SchedulerConfig scheduler();

    /**
     * Credential renewal configuration.
     */
    AuthConfig auth();

    /**
     * Notification channel configuration.
     */
    NotificationConfig notifications();

    /**
     * Durable storage configuration.
     */
    StorageConfig storage();

    interface HttpConfig {
        /**
         * Call timeout in seconds.
         */
        @WithDefault("30")
        int timeout();

        /**
         * Number of retries after the first failed attempt.
         */
        @WithName("retry-attempts")
        @WithDefault("3")
        int retryAttempts();

        /**
         * Base delay for exponential backoff in milliseconds.
         */
        @WithName("retry-delay")
        @WithDefault("1000")
        long retryDelay();
    }

    interface CacheConfig {
        /**
         * Maximum number of entries in the in-process tier.
         */
        @WithDefault("100")
        int capacity();

        /**
         * Default entry TTL in milliseconds.
         */
        @WithDefault("300000")
        long ttl();

        /**
         * TTL in milliseconds used for rarely-changing reference data.
         */
        @WithName("reference-ttl")
        @WithDefault("3600000")
        long referenceTtl();
    }

    interface SchedulerConfig {
        /**
         * Maximum number of calls executing at once.
         */
        @WithName("max-concurrent")
        @WithDefault("5")
        int maxConcurrent();
    }

    interface AuthConfig {
        /**
         * Path of the credential-issuing endpoint, relative to the base URL.
         */
        @WithName("refresh-path")
        @WithDefault("/api/auth/refresh")
        String refreshPath();
    }

    interface NotificationConfig {
        /**
         * Base URL of the notification channel. Sessions connect to {ws-url}/ws/{sessionId}.
         */
        @WithName("ws-url")
        @WithDefault("ws://localhost:8000")
        String wsUrl();
    }

    interface StorageConfig {
        /**
         * Directory for durable entries. When absent, durable entries live in memory only.
         */
        Optional<String> directory();
    }
}
