package io.otel.messaging.trace;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;

import java.util.Map;

/**
 * Converts loosely typed attribute maps into OpenTelemetry {@link Attributes}.
 */
public final class AttributeValues {

    private AttributeValues() {
        // Utility class
    }

    public static Attributes toAttributes(Map<String, ?> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            return Attributes.empty();
        }
        AttributesBuilder builder = Attributes.builder();
        attributes.forEach((key, value) -> put(builder, key, value));
        return builder.build();
    }

    public static void put(AttributesBuilder builder, String key, Object value) {
        if (key == null || value == null) {
            return;
        }
        if (value instanceof String) {
            builder.put(AttributeKey.stringKey(key), (String) value);
        } else if (value instanceof Long || value instanceof Integer || value instanceof Short) {
            builder.put(AttributeKey.longKey(key), ((Number) value).longValue());
        } else if (value instanceof Double || value instanceof Float) {
            builder.put(AttributeKey.doubleKey(key), ((Number) value).doubleValue());
        } else if (value instanceof Boolean) {
            builder.put(AttributeKey.booleanKey(key), (Boolean) value);
        } else {
            builder.put(AttributeKey.stringKey(key), value.toString());
        }
    }
}
