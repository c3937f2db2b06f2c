package tech.unifiedportal.sdk.client;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome of a successful call.
 *
 * @param data response payload, JSON null for an empty body
 * @param fromCache served from the response cache without a remote call
 * @param status HTTP status; 200 for cache hits
 */
public record CallResult(JsonNode data, boolean fromCache, int status) {}
