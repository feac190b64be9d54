package com.health.compliance.reporting;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.health.compliance.model.ArtifactFormat;

import java.util.Collection;
import java.util.Map;

/**
 * Turns a report document (nested maps, lists and scalars) into artifact text. JSON keeps the
 * structure; CSV flattens it to {@code Metric,Value} rows with dotted metric names.
 */
public class ReportRenderer {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    public String render(Map<String, Object> document, ArtifactFormat format) {
        return switch (format) {
            case JSON -> toJson(document);
            case CSV -> toCsv(document);
        };
    }

    String toJson(Object document) {
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize report document", e);
        }
    }

    String toCsv(Map<String, Object> document) {
        StringBuilder sb = new StringBuilder("Metric,Value\n");
        flatten("", document, sb);
        return sb.toString();
    }

    private void flatten(String prefix, Object value, StringBuilder sb) {
        if (value instanceof Map) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                flatten(join(prefix, String.valueOf(entry.getKey())), entry.getValue(), sb);
            }
        } else if (value instanceof Collection) {
            int i = 0;
            for (Object item : (Collection<?>) value) {
                flatten(join(prefix, String.valueOf(i++)), item, sb);
            }
        } else if (value != null && !isScalar(value)) {
            // Beans such as RiskAssessment go through Jackson's map view.
            flatten(prefix, objectMapper.convertValue(value, Map.class), sb);
        } else {
            sb.append(CsvExportRenderer.csv(prefix))
                    .append(',')
                    .append(CsvExportRenderer.csv(value != null ? String.valueOf(value) : ""))
                    .append('\n');
        }
    }

    private static boolean isScalar(Object value) {
        return value instanceof CharSequence || value instanceof Number
                || value instanceof Boolean || value instanceof Enum;
    }

    private static String join(String prefix, String key) {
        return prefix.isEmpty() ? key : prefix + "." + key;
    }
}
