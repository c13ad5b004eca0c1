package com.company.adaptive.cache;

import com.company.adaptive.domain.enums.OperationKind;
import com.company.adaptive.dto.request.StoreRequest;
import com.company.adaptive.exception.InvalidRequestException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Derives cache keys from an operation, its normalized arguments and the scope.
 * Arguments are rendered as canonical JSON (map keys sorted) and hashed with SHA-256,
 * so logically equal requests map to the same key.
 */
@Component
public class CacheKeyGenerator {

    private final ObjectMapper canonicalMapper = JsonMapper.builder()
            .findAndAddModules()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    public String keyFor(String scope, OperationKind kind, String collection, StoreRequest request) {
        Map<String, Object> material = new TreeMap<>();
        material.put("operation", kind.tagValue());
        material.put("collection", collection);
        material.put("scope", scope);
        material.put("args", normalizedArgs(request));
        return sha256(canonicalJson(material));
    }

    /**
     * Canonical JSON of an arbitrary value; equal maps render identically regardless
     * of insertion order.
     */
    public String canonicalJson(Object value) {
        try {
            return canonicalMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value cannot be rendered as JSON: " + e.getOriginalMessage(), e);
        }
    }

    private Map<String, Object> normalizedArgs(StoreRequest request) {
        Map<String, Object> args = new LinkedHashMap<>();
        if (request == null) {
            return args;
        }
        if (request.getIds() != null) {
            if (request.getIds().stream().anyMatch(Objects::isNull)) {
                throw new InvalidRequestException("ids must not contain null");
            }
            args.put("ids", request.getIds().stream().sorted().toList());
        }
        if (request.getWhere() != null) {
            args.put("where", new TreeMap<>(request.getWhere()));
        }
        if (request.getText() != null) {
            args.put("text", request.getText().trim());
        }
        if (request.getLimit() != null) {
            args.put("limit", request.getLimit());
        }
        return args;
    }

    private static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
