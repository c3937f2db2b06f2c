package tech.unifiedportal.sdk.client.transport;

import tech.unifiedportal.sdk.enums.HttpMethod;

import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A fully built call, ready to hand to the transport.
 *
 * @param method HTTP method
 * @param uri absolute target including query string
 * @param headers request headers
 * @param body serialized JSON body, or null for methods without a body
 * @param timeout transport-level timeout
 */
public record OutgoingCall(
    HttpMethod method,
    URI uri,
    Map<String, String> headers,
    String body,
    Duration timeout
) {

    private static final String AUTHORIZATION = "Authorization";
    private static final String BEARER_PREFIX = "Bearer ";

    public OutgoingCall {
        headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public OutgoingCall withHeader(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(headers);
        copy.put(name, value);
        return new OutgoingCall(method, uri, copy, body, timeout);
    }

    /**
     * The bearer token carried by this call, or null when unauthenticated.
     */
    public String bearerToken() {
        String value = headers.get(AUTHORIZATION);
        if (value == null || !value.startsWith(BEARER_PREFIX)) {
            return null;
        }
        return value.substring(BEARER_PREFIX.length());
    }
}
