package com.suipatreon.indexer.util;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads Move event fields out of a {@code parsedJson} payload.
 *
 * <p>Sui renders {@code u64} and wider integers as decimal strings, {@code vector<u8>} as
 * an array of byte values and object ids / addresses as {@code 0x} hex strings.
 */
public final class EventFields {

    private EventFields() {
    }

    public static String requireText(JsonNode payload, String field) {
        String value = text(payload, field);
        if (value == null) {
            throw new IllegalArgumentException("Missing event field: " + field);
        }
        return value;
    }

    /**
     * Returns the field as text, decoding byte vectors as UTF-8. Null if absent.
     */
    public static String text(JsonNode payload, String field) {
        JsonNode node = payload.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isArray()) {
            ByteArrayOutputStream bytes = new ByteArrayOutputStream();
            for (JsonNode b : node) {
                bytes.write(b.asInt());
            }
            return bytes.toString(StandardCharsets.UTF_8);
        }
        return node.asText();
    }

    /**
     * Same as {@link #text} but maps blank strings to null.
     */
    public static String optionalText(JsonNode payload, String field) {
        String value = text(payload, field);
        return value == null || value.isBlank() ? null : value;
    }

    public static BigInteger requireBigInteger(JsonNode payload, String field) {
        JsonNode node = payload.get(field);
        if (node == null || node.isNull()) {
            throw new IllegalArgumentException("Missing event field: " + field);
        }
        if (node.isIntegralNumber()) {
            return node.bigIntegerValue();
        }
        try {
            return new BigInteger(node.asText().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Field " + field + " is not an integer: " + node.asText(), e);
        }
    }

    /**
     * Millisecond timestamp field as an instant, or null when absent.
     */
    public static Instant instant(JsonNode payload, String field) {
        JsonNode node = payload.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        return Instant.ofEpochMilli(requireBigInteger(payload, field).longValueExact());
    }

    public static boolean bool(JsonNode payload, String field, boolean defaultValue) {
        JsonNode node = payload.get(field);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return Boolean.parseBoolean(node.asText());
    }

    /**
     * Integer field, falling back to {@code defaultValue} when absent or not numeric.
     */
    public static int intValue(JsonNode payload, String field, int defaultValue) {
        JsonNode node = payload.get(field);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        if (node.isIntegralNumber()) {
            return node.asInt();
        }
        try {
            return Integer.parseInt(node.asText().trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public static List<String> textList(JsonNode payload, String field) {
        List<String> values = new ArrayList<>();
        JsonNode node = payload.get(field);
        if (node == null || !node.isArray()) {
            return values;
        }
        for (JsonNode item : node) {
            values.add(item.asText());
        }
        return values;
    }
}
