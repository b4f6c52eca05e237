package org.tabula.config;

import org.tabula.errors.ConfigException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Declares which keys an adapter variant requires, which values an enumerated key may hold,
 * and which defaults apply to optional keys. Evaluated once, when the adapter is constructed.
 */
public final class ConfigSchema {

    private final String adapterName;
    private final List<String> required;
    private final Map<String, Set<String>> allowedValues;
    private final Map<String, Object> defaults;

    private ConfigSchema(Builder builder) {
        this.adapterName = builder.adapterName;
        this.required = List.copyOf(builder.required);
        this.allowedValues = Collections.unmodifiableMap(new LinkedHashMap<>(builder.allowedValues));
        this.defaults = Collections.unmodifiableMap(new LinkedHashMap<>(builder.defaults));
    }

    public static Builder forAdapter(String adapterName) {
        return new Builder(adapterName);
    }

    public void validate(final AdapterConfig config) throws ConfigException {
        for (String key : required) {
            if (!config.containsKey(key)) {
                throw new ConfigException(adapterName + ": Missing required field: " + key);
            }
        }
        for (Map.Entry<String, Set<String>> entry : allowedValues.entrySet()) {
            Object value = config.get(entry.getKey());
            if (value != null && !entry.getValue().contains(value.toString())) {
                throw new ConfigException(adapterName + ": Unsupported value '" + value + "' for '" + entry.getKey()
                                          + "', expected one of " + entry.getValue());
            }
        }
    }

    public Object defaultFor(String key) {
        return defaults.get(key);
    }

    public List<String> required() {
        return required;
    }

    public static final class Builder {
        private final String adapterName;
        private final List<String> required = new ArrayList<>();
        private final Map<String, Set<String>> allowedValues = new LinkedHashMap<>();
        private final Map<String, Object> defaults = new LinkedHashMap<>();

        private Builder(String adapterName) {
            this.adapterName = adapterName;
        }

        public Builder require(String... keys) {
            required.addAll(List.of(keys));
            return this;
        }

        public Builder allow(String key, String... values) {
            allowedValues.put(key, Set.of(values));
            return this;
        }

        public Builder optional(String key, Object defaultValue) {
            defaults.put(key, defaultValue);
            return this;
        }

        public ConfigSchema build() {
            return new ConfigSchema(this);
        }
    }
}
