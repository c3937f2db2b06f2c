package tech.unifiedportal.sdk.notification;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Events delivered to listeners on the {@link PortalEventBus}.
 *
 * <p>Inbound notification frames decode into {@link SystemMessage},
 * {@link Notification} or {@link Generic}. The client itself raises
 * {@link AuthenticationFailed} and {@link ChannelError}.
 */
public sealed interface PortalEvent {

    /**
     * Wire name of the event type.
     */
    String type();

    /**
     * Broadcast from the platform to every session.
     */
    record SystemMessage(String message, JsonNode payload) implements PortalEvent {
        public static final String TYPE = "system_message";

        @Override
        public String type() {
            return TYPE;
        }
    }

    /**
     * User-facing notification addressed to this session.
     */
    record Notification(String severity, String title, String message, JsonNode payload) implements PortalEvent {
        public static final String TYPE = "notification";

        @Override
        public String type() {
            return TYPE;
        }
    }

    /**
     * Any other frame type, passed through untouched.
     */
    record Generic(String type, JsonNode payload) implements PortalEvent {}

    /**
     * Credential renewal failed and stored credentials were cleared.
     */
    record AuthenticationFailed(String reason, Instant occurredAt) implements PortalEvent {
        public static final String TYPE = "auth-failure";

        @Override
        public String type() {
            return TYPE;
        }
    }

    /**
     * The notification channel failed.
     */
    record ChannelError(String sessionId, Throwable cause) implements PortalEvent {
        public static final String TYPE = "channel-error";

        @Override
        public String type() {
            return TYPE;
        }
    }
}
