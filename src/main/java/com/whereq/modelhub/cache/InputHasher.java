package com.whereq.modelhub.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 of the canonical JSON form of a prediction input. Object keys are sorted so
 * inputs that differ only in key order share an entry.
 */
public final class InputHasher {

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .build();

    private InputHasher() {
    }

    public static String hash(JsonNode input) {
        try {
            Object canonical = CANONICAL.treeToValue(input, Object.class);
            byte[] json = CANONICAL.writeValueAsBytes(canonical);
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(json));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        } catch (Exception e) {
            throw new IllegalArgumentException("Cannot hash prediction input", e);
        }
    }
}
