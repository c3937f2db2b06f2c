package tech.unifiedportal.sdk.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import org.jboss.logging.Logger;

import java.util.Optional;

/**
 * Decodes inbound notification frames of the form {@code {"type": ..., "payload": ...}}.
 */
public final class NotificationFrames {

    private static final Logger LOG = Logger.getLogger(NotificationFrames.class);

    private NotificationFrames() {}

    /**
     * @return the decoded event, or empty when the frame is malformed
     */
    public static Optional<PortalEvent> decode(ObjectMapper objectMapper, String frame) {
        JsonNode root;
        try {
            root = objectMapper.readTree(frame);
        } catch (JsonProcessingException e) {
            LOG.warnf("Dropping malformed notification frame: %s", e.getOriginalMessage());
            return Optional.empty();
        }

        if (root == null || !root.isObject() || !root.path("type").isTextual()) {
            LOG.warnf("Dropping notification frame without a type");
            return Optional.empty();
        }

        String type = root.get("type").asText();
        JsonNode payload = root.has("payload") ? root.get("payload") : NullNode.getInstance();

        return Optional.of(switch (type) {
            case PortalEvent.SystemMessage.TYPE ->
                new PortalEvent.SystemMessage(text(payload, "message"), payload);
            case PortalEvent.Notification.TYPE ->
                new PortalEvent.Notification(text(payload, "severity"), text(payload, "title"),
                    text(payload, "message"), payload);
            default -> new PortalEvent.Generic(type, payload);
        });
    }

    private static String text(JsonNode payload, String field) {
        JsonNode value = payload.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }
}
