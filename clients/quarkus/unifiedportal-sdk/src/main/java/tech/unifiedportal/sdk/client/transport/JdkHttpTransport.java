package tech.unifiedportal.sdk.client.transport;

import org.jboss.logging.Logger;
import tech.unifiedportal.sdk.exception.RequestErrorException;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Transport backed by {@link java.net.http.HttpClient}.
 */
public class JdkHttpTransport implements PortalTransport {

    private static final Logger LOG = Logger.getLogger(JdkHttpTransport.class);

    private final HttpClient httpClient;

    public JdkHttpTransport(Duration connectTimeout) {
        this(HttpClient.newBuilder()
            .connectTimeout(connectTimeout)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build());
    }

    public JdkHttpTransport(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public CompletableFuture<TransportResponse> send(OutgoingCall call) {
        HttpRequest request;
        try {
            request = toRequest(call);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(RequestErrorException.invalidTarget(call.uri().toString(), e));
        }

        LOG.debugf("%s %s", call.method(), call.uri());
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
            .thenApply(response -> new TransportResponse(
                response.statusCode(),
                response.headers().map(),
                response.body()));
    }

    private HttpRequest toRequest(OutgoingCall call) {
        HttpRequest.BodyPublisher publisher = call.body() != null
            ? HttpRequest.BodyPublishers.ofString(call.body())
            : HttpRequest.BodyPublishers.noBody();

        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(call.uri())
            .timeout(call.timeout())
            .method(call.method().name(), publisher);
        call.headers().forEach(builder::header);
        return builder.build();
    }
}
