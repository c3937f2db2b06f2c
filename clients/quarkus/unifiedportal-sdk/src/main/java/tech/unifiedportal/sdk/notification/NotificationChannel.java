package tech.unifiedportal.sdk.notification;

import java.util.concurrent.CompletableFuture;

/**
 * Duplex notification channel keyed by a session identifier.
 */
public interface NotificationChannel {

    CompletableFuture<ChannelConnection> connect(String sessionId, FrameListener listener);
}
