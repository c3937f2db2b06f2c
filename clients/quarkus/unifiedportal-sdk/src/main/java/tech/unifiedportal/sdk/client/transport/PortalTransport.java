package tech.unifiedportal.sdk.client.transport;

import java.util.concurrent.CompletableFuture;

/**
 * Request/response transport the client sends calls through.
 *
 * <p>A returned future completes with the response for any status code. It fails
 * only when no response was received (connection refused, timeout) or the call
 * could not be sent at all.
 */
public interface PortalTransport {

    CompletableFuture<TransportResponse> send(OutgoingCall call);
}
