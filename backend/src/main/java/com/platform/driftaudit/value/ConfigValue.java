package com.platform.driftaudit.value;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Decoded configuration tree node.
 * 
 * Closed over the six JSON shapes. Instances are immutable; collections are copied on construction.
 */
public sealed interface ConfigValue permits ConfigValue.NullValue, ConfigValue.BoolValue,
        ConfigValue.NumberValue, ConfigValue.StringValue, ConfigValue.SequenceValue, ConfigValue.MappingValue {
    
    NullValue NULL = new NullValue();
    
    static ConfigValue of(boolean value) {
        return new BoolValue(value);
    }
    
    static ConfigValue of(long value) {
        return new NumberValue(BigDecimal.valueOf(value));
    }
    
    static ConfigValue of(double value) {
        return new NumberValue(BigDecimal.valueOf(value));
    }
    
    static ConfigValue of(String value) {
        return value == null ? NULL : new StringValue(value);
    }
    
    static ConfigValue sequence(ConfigValue... elements) {
        return new SequenceValue(List.of(elements));
    }
    
    /**
     * Builds a mapping from alternating key/value arguments.
     */
    static ConfigValue mapping(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected key/value pairs, got " + keysAndValues.length + " arguments");
        }
        Map<String, ConfigValue> entries = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            entries.put((String) keysAndValues[i], (ConfigValue) keysAndValues[i + 1]);
        }
        return new MappingValue(entries);
    }
    
    default boolean isNull() {
        return this instanceof NullValue;
    }
    
    /**
     * JSON null.
     */
    record NullValue() implements ConfigValue {
        @Override
        public String toString() {
            return "null";
        }
    }
    
    record BoolValue(boolean value) implements ConfigValue {
        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }
    
    /**
     * Numbers are kept as {@link BigDecimal}; equality is numeric, so {@code 1} and {@code 1.0} match.
     */
    record NumberValue(BigDecimal value) implements ConfigValue {
        
        public NumberValue {
            Objects.requireNonNull(value, "value");
        }
        
        @Override
        public boolean equals(Object o) {
            return o instanceof NumberValue other && value.compareTo(other.value) == 0;
        }
        
        @Override
        public int hashCode() {
            return value.stripTrailingZeros().hashCode();
        }
        
        @Override
        public String toString() {
            return value.stripTrailingZeros().toPlainString();
        }
    }
    
    record StringValue(String value) implements ConfigValue {
        
        public StringValue {
            Objects.requireNonNull(value, "value");
        }
        
        @Override
        public String toString() {
            return value;
        }
    }
    
    record SequenceValue(List<ConfigValue> elements) implements ConfigValue {
        
        public SequenceValue {
            elements = List.copyOf(elements);
        }
        
        public int size() {
            return elements.size();
        }
        
        public ConfigValue get(int index) {
            return elements.get(index);
        }
    }
    
    record MappingValue(Map<String, ConfigValue> entries) implements ConfigValue {
        
        public MappingValue {
            entries.forEach((key, value) -> {
                Objects.requireNonNull(key, "mapping key");
                Objects.requireNonNull(value, () -> "mapping value for key " + key);
            });
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }
        
        public boolean containsKey(String key) {
            return entries.containsKey(key);
        }
        
        public ConfigValue get(String key) {
            return entries.get(key);
        }
    }
}
