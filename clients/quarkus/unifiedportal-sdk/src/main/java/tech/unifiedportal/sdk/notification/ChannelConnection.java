package tech.unifiedportal.sdk.notification;

import java.util.concurrent.CompletableFuture;

/**
 * An open duplex connection.
 */
public interface ChannelConnection {

    CompletableFuture<Void> send(String frame);

    CompletableFuture<Void> close();
}
