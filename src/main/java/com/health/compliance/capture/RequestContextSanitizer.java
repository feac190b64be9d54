package com.health.compliance.capture;

import com.health.compliance.config.CaptureConfig;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Strips credentials from what capture stores: drops excluded headers and masks sensitive
 * fields anywhere in a request body.
 */
@Component
public class RequestContextSanitizer {

    private final Set<String> excludedHeaders;
    private final Set<String> maskedFields;
    private final String maskValue;

    public RequestContextSanitizer(CaptureConfig config) {
        this.excludedHeaders = lowerCase(config.getExcludedHeaders());
        this.maskedFields = lowerCase(config.getMaskedFields());
        this.maskValue = config.getMaskValue();
    }

    public Map<String, String> sanitizeHeaders(Map<String, String> headers) {
        Map<String, String> result = new LinkedHashMap<>();
        if (headers == null) return result;
        headers.forEach((name, value) -> {
            if (!excludedHeaders.contains(name.toLowerCase(Locale.ROOT))) {
                result.put(name, value);
            }
        });
        return result;
    }

    public Map<String, Object> sanitizePayload(Map<String, Object> payload) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (payload == null) return result;
        payload.forEach((key, value) -> result.put(key, isMasked(key) ? maskValue : sanitizeValue(value)));
        return result;
    }

    @SuppressWarnings("unchecked")
    private Object sanitizeValue(Object value) {
        if (value instanceof Map) {
            return sanitizePayload((Map<String, Object>) value);
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (List<Object>) value) {
                copy.add(sanitizeValue(item));
            }
            return copy;
        }
        return value;
    }

    private boolean isMasked(String key) {
        String lower = key.toLowerCase(Locale.ROOT);
        for (String field : maskedFields) {
            if (lower.contains(field)) return true;
        }
        return false;
    }

    private static Set<String> lowerCase(List<String> values) {
        return values.stream().map(v -> v.toLowerCase(Locale.ROOT)).collect(Collectors.toUnmodifiableSet());
    }
}
