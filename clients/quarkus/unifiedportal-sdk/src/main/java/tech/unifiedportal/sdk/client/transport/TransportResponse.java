package tech.unifiedportal.sdk.client.transport;

import java.util.List;
import java.util.Map;

/**
 * Raw response from the transport.
 */
public record TransportResponse(int status, Map<String, List<String>> headers, String body) {

    public TransportResponse {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static TransportResponse of(int status, String body) {
        return new TransportResponse(status, Map.of(), body);
    }

    public boolean isError() {
        return status >= 400;
    }
}
