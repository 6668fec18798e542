package com.linlay.agentcoordinator.dispatch;

import java.util.Map;

/**
 * Field access on opaque request payloads.
 */
public final class Payloads {

    private Payloads() {
    }

    public static String requireText(Map<String, Object> data, String field) {
        String value = optionalText(data, field);
        if (value == null) {
            throw new IllegalArgumentException("Missing " + field + " in request");
        }
        return value;
    }

    public static String optionalText(Map<String, Object> data, String field) {
        Object raw = data == null ? null : data.get(field);
        if (raw == null) {
            return null;
        }
        String text = String.valueOf(raw).trim();
        return text.isEmpty() ? null : text;
    }

    public static void requirePresent(Map<String, Object> data, String field) {
        if (data == null || data.get(field) == null) {
            throw new IllegalArgumentException("Missing " + field + " in request");
        }
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> optionalMap(Map<String, Object> data, String field) {
        Object raw = data == null ? null : data.get(field);
        if (raw == null) {
            return Map.of();
        }
        if (!(raw instanceof Map<?, ?>)) {
            throw new IllegalArgumentException(field + " must be an object");
        }
        return (Map<String, Object>) raw;
    }

    public static Map<String, Object> requireMap(Map<String, Object> data, String field) {
        requirePresent(data, field);
        return optionalMap(data, field);
    }

    public static Object valueOrDefault(Map<String, Object> data, String field, Object fallback) {
        Object raw = data == null ? null : data.get(field);
        return raw == null ? fallback : raw;
    }

    public static Long optionalLong(Map<String, Object> data, String field) {
        Object raw = data == null ? null : data.get(field);
        if (raw == null) {
            return null;
        }
        if (raw instanceof Number number) {
            return number.longValue();
        }
        try {
            return Long.parseLong(String.valueOf(raw).trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(field + " must be a number", ex);
        }
    }
}
