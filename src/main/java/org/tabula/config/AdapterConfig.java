package org.tabula.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable string-keyed adapter configuration. Defaults declared by a {@link ConfigSchema}
 * are served on lookup and never written back.
 */
public final class AdapterConfig {

    private final Map<String, Object> values;
    private final ConfigSchema schema;

    public AdapterConfig(Map<String, ?> values, ConfigSchema schema) {
        // LinkedHashMap: callers may legitimately pass null values, which Map.copyOf rejects
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values == null ? Map.of() : values));
        this.schema = schema;
    }

    public boolean containsKey(String key) {
        return values.containsKey(key) && values.get(key) != null;
    }

    public Object get(String key) {
        Object value = values.get(key);
        return value != null ? value : schema.defaultFor(key);
    }

    public String getString(String key) {
        Object value = get(key);
        return value == null ? null : value.toString();
    }

    public int getInt(String key, int fallback) {
        Object value = get(key);
        if (value instanceof Number n) return n.intValue();
        if (value == null) return fallback;
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    /**
     * @return a read-only copy of the nested map under {@code key} with keys as text, empty when absent or not a map
     */
    public Map<String, Object> getMap(String key) {
        Object value = get(key);
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), v));
            return Collections.unmodifiableMap(copy);
        }
        return Map.of();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "AdapterConfig" + values;
    }
}
