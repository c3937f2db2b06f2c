package tech.unifiedportal.sdk.client.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Derives cache keys from a call's target, parameters and headers.
 *
 * <p>The same logical call always yields the same key: object fields and query
 * pairs are sorted, header names are lower-cased.
 */
public final class CacheKeys {

    private CacheKeys() {}

    public static String derive(ObjectMapper objectMapper, String target, JsonNode params,
                                Map<String, String> headers) {
        ObjectNode canonical = objectMapper.createObjectNode();
        canonical.put("target", canonicalTarget(target));
        canonical.set("params", params == null ? NullNode.getInstance() : canonicalize(objectMapper, params));

        ObjectNode headerNode = canonical.putObject("headers");
        if (headers != null) {
            Map<String, String> sorted = new TreeMap<>();
            headers.forEach((name, value) -> sorted.put(name.toLowerCase(Locale.ROOT), value));
            sorted.forEach(headerNode::put);
        }

        try {
            return sha256(objectMapper.writeValueAsString(canonical));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize cache key material", e);
        }
    }

    static String canonicalTarget(String target) {
        int queryStart = target.indexOf('?');
        if (queryStart < 0) {
            return target;
        }
        String[] pairs = target.substring(queryStart + 1).split("&");
        Arrays.sort(pairs);
        return target.substring(0, queryStart) + "?" + String.join("&", pairs);
    }

    static JsonNode canonicalize(ObjectMapper objectMapper, JsonNode node) {
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            Iterator<String> it = node.fieldNames();
            it.forEachRemaining(names::add);
            names.sort(null);

            ObjectNode sorted = objectMapper.createObjectNode();
            for (String name : names) {
                sorted.set(name, canonicalize(objectMapper, node.get(name)));
            }
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode array = objectMapper.createArrayNode();
            node.forEach(element -> array.add(canonicalize(objectMapper, element)));
            return array;
        }
        return node;
    }

    private static String sha256(String material) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
