package com.platform.driftaudit.diff;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.platform.driftaudit.value.ConfigValue;
import com.platform.driftaudit.value.ConfigValueSerializer;

import java.util.Objects;

/**
 * A single field-level difference.
 * 
 * {@code null} on either side means the field is absent there; a JSON null that is present is
 * {@link ConfigValue#NULL}. At least one side is always present.
 */
@JsonPropertyOrder({"path", "field", "old_value", "new_value", "change_type"})
public record FieldChange(
    String path,
    @JsonProperty("old_value") @JsonSerialize(using = ConfigValueSerializer.class) ConfigValue oldValue,
    @JsonProperty("new_value") @JsonSerialize(using = ConfigValueSerializer.class) ConfigValue newValue,
    @JsonProperty("change_type") ChangeKind kind
) {
    
    public FieldChange {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(kind, "kind");
        if (oldValue == null && newValue == null) {
            throw new IllegalArgumentException("Change at '" + path + "' has neither an old nor a new value");
        }
    }
    
    public static FieldChange added(String path, ConfigValue newValue) {
        return new FieldChange(path, null, newValue, ChangeKind.ADDED);
    }
    
    public static FieldChange removed(String path, ConfigValue oldValue) {
        return new FieldChange(path, oldValue, null, ChangeKind.REMOVED);
    }
    
    public static FieldChange modified(String path, ConfigValue oldValue, ConfigValue newValue) {
        return new FieldChange(path, oldValue, newValue, ChangeKind.MODIFIED);
    }
    
    /**
     * Last path segment without any index suffix, e.g. {@code "c"} for {@code "a.b[2].c"}.
     */
    @JsonProperty("field")
    public String field() {
        String segment = path.substring(path.lastIndexOf('.') + 1);
        int bracket = segment.indexOf('[');
        return bracket >= 0 ? segment.substring(0, bracket) : segment;
    }
    
    @JsonIgnore
    public boolean isAdded() {
        return kind == ChangeKind.ADDED;
    }
    
    @JsonIgnore
    public boolean isRemoved() {
        return kind == ChangeKind.REMOVED;
    }
    
    @JsonIgnore
    public boolean isModified() {
        return kind == ChangeKind.MODIFIED;
    }
}
