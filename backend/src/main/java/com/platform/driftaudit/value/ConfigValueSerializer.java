package com.platform.driftaudit.value;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.platform.driftaudit.value.ConfigValue.BoolValue;
import com.platform.driftaudit.value.ConfigValue.MappingValue;
import com.platform.driftaudit.value.ConfigValue.NumberValue;
import com.platform.driftaudit.value.ConfigValue.SequenceValue;
import com.platform.driftaudit.value.ConfigValue.StringValue;

import java.io.IOException;
import java.util.Map;

/**
 * Writes a {@link ConfigValue} as the plain JSON it was decoded from.
 */
public class ConfigValueSerializer extends StdSerializer<ConfigValue> {
    
    public ConfigValueSerializer() {
        super(ConfigValue.class);
    }
    
    @Override
    public void serialize(ConfigValue value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        if (value instanceof BoolValue b) {
            gen.writeBoolean(b.value());
        } else if (value instanceof NumberValue n) {
            gen.writeNumber(n.value());
        } else if (value instanceof StringValue s) {
            gen.writeString(s.value());
        } else if (value instanceof SequenceValue seq) {
            gen.writeStartArray();
            for (ConfigValue element : seq.elements()) {
                serialize(element, gen, provider);
            }
            gen.writeEndArray();
        } else if (value instanceof MappingValue mapping) {
            gen.writeStartObject();
            for (Map.Entry<String, ConfigValue> entry : mapping.entries().entrySet()) {
                gen.writeFieldName(entry.getKey());
                serialize(entry.getValue(), gen, provider);
            }
            gen.writeEndObject();
        } else {
            gen.writeNull();
        }
    }
}
