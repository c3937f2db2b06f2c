package tech.unifiedportal.sdk.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jboss.logging.Logger;
import tech.unifiedportal.sdk.exception.RequestErrorException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps one notification session open and republishes its frames on the event bus.
 */
public class NotificationService implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(NotificationService.class);

    private final NotificationChannel channel;
    private final PortalEventBus eventBus;
    private final ObjectMapper objectMapper;

    private final AtomicReference<ChannelConnection> connection = new AtomicReference<>();

    public NotificationService(NotificationChannel channel, PortalEventBus eventBus, ObjectMapper objectMapper) {
        this.channel = channel;
        this.eventBus = eventBus;
        this.objectMapper = objectMapper;
    }

    /**
     * Open the session's channel, replacing any previous connection.
     */
    public CompletableFuture<Void> connect(String sessionId) {
        disconnect();
        return channel.connect(sessionId, new FrameListener() {
            @Override
            public void onFrame(String frame) {
                NotificationFrames.decode(objectMapper, frame).ifPresent(eventBus::publish);
            }

            @Override
            public void onError(Throwable error) {
                LOG.warnf(error, "Notification channel for session [%s] failed", sessionId);
                connection.set(null);
                eventBus.publish(new PortalEvent.ChannelError(sessionId, error));
            }

            @Override
            public void onClosed(int statusCode, String reason) {
                LOG.infof("Notification channel for session [%s] closed: %d %s", sessionId, statusCode, reason);
                connection.set(null);
            }
        }).thenAccept(opened -> {
            connection.set(opened);
            LOG.infof("Notification channel for session [%s] open", sessionId);
        });
    }

    /**
     * Send a {@code {type, payload}} frame on the open connection.
     */
    public CompletableFuture<Void> send(String type, JsonNode payload) {
        ChannelConnection current = connection.get();
        if (current == null) {
            return CompletableFuture.failedFuture(
                new IllegalStateException("Notification channel is not connected"));
        }

        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("type", type);
        frame.set("payload", payload);
        try {
            return current.send(objectMapper.writeValueAsString(frame));
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(RequestErrorException.unserializablePayload(e));
        }
    }

    public boolean isConnected() {
        return connection.get() != null;
    }

    public void disconnect() {
        ChannelConnection previous = connection.getAndSet(null);
        if (previous != null) {
            previous.close();
        }
    }

    @Override
    public void close() {
        disconnect();
    }
}
