package tech.unifiedportal.sdk.notification;

import org.jboss.logging.Logger;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.charset.StandardCharsets;
import java.net.URLEncoder;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Notification channel over {@link java.net.http.WebSocket}, connecting to
 * {@code {wsUrl}/ws/{sessionId}}.
 */
public class JdkWebSocketChannel implements NotificationChannel {

    private static final Logger LOG = Logger.getLogger(JdkWebSocketChannel.class);

    private final HttpClient httpClient;
    private final String wsUrl;

    public JdkWebSocketChannel(HttpClient httpClient, String wsUrl) {
        this.httpClient = httpClient;
        this.wsUrl = wsUrl.endsWith("/") ? wsUrl.substring(0, wsUrl.length() - 1) : wsUrl;
    }

    URI endpointFor(String sessionId) {
        return URI.create(wsUrl + "/ws/" + URLEncoder.encode(sessionId, StandardCharsets.UTF_8));
    }

    @Override
    public CompletableFuture<ChannelConnection> connect(String sessionId, FrameListener listener) {
        URI endpoint = endpointFor(sessionId);
        LOG.infof("Connecting notification channel to [%s]", endpoint);
        return httpClient.newWebSocketBuilder()
            .buildAsync(endpoint, new Adapter(listener))
            .thenApply(Connection::new);
    }

    private static final class Adapter implements WebSocket.Listener {

        private final FrameListener listener;
        private final StringBuilder partial = new StringBuilder();

        Adapter(FrameListener listener) {
            this.listener = listener;
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                String frame = partial.toString();
                partial.setLength(0);
                listener.onFrame(frame);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            listener.onClosed(statusCode, reason);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            listener.onError(error);
        }
    }

    private record Connection(WebSocket webSocket) implements ChannelConnection {

        @Override
        public CompletableFuture<Void> send(String frame) {
            return webSocket.sendText(frame, true).thenApply(ws -> null);
        }

        @Override
        public CompletableFuture<Void> close() {
            return webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "client closing").thenApply(ws -> null);
        }
    }
}
