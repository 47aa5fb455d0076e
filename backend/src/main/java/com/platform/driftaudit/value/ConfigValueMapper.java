package com.platform.driftaudit.value;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.driftaudit.error.ConfigDecodingException;
import com.platform.driftaudit.error.ErrorCode;
import com.platform.driftaudit.value.ConfigValue.BoolValue;
import com.platform.driftaudit.value.ConfigValue.MappingValue;
import com.platform.driftaudit.value.ConfigValue.NullValue;
import com.platform.driftaudit.value.ConfigValue.NumberValue;
import com.platform.driftaudit.value.ConfigValue.SequenceValue;
import com.platform.driftaudit.value.ConfigValue.StringValue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decoding boundary between JSON documents and {@link ConfigValue} trees.
 * 
 * Malformed documents are rejected here so the engine only ever sees valid trees.
 */
@Slf4j
@Component
public class ConfigValueMapper {
    
    private static final String ABSENT = "<none>";
    private static final JsonNodeFactory NODES = JsonNodeFactory.withExactBigDecimals(true);
    
    private final ObjectMapper objectMapper;
    private final ObjectReader treeReader;
    
    public ConfigValueMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.treeReader = objectMapper.reader()
            .with(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .with(NODES);
    }
    
    /**
     * Parse a JSON document.
     *
     * @param document label used in error messages, e.g. "baseline"
     */
    public ConfigValue read(String json, String document) {
        if (json == null || json.isBlank()) {
            throw new ConfigDecodingException(ErrorCode.MALFORMED_CONFIGURATION, document, "document is empty");
        }
        JsonNode tree;
        try {
            tree = treeReader.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("Rejected malformed {} config: {}", document, e.getOriginalMessage());
            throw new ConfigDecodingException(document, e);
        }
        try {
            return fromJsonNode(tree, document);
        } catch (NumberFormatException | ArithmeticException e) {
            log.warn("Rejected unrepresentable number in {} config: {}", document, e.getMessage());
            throw new ConfigDecodingException(document, e);
        }
    }
    
    private ConfigValue fromJsonNode(JsonNode node, String document) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return ConfigValue.NULL;
        }
        if (node.isBoolean()) {
            return new BoolValue(node.booleanValue());
        }
        if (node.isNumber()) {
            return new NumberValue(node.decimalValue());
        }
        if (node.isTextual()) {
            return new StringValue(node.textValue());
        }
        if (node.isArray()) {
            List<ConfigValue> elements = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                elements.add(fromJsonNode(element, document));
            }
            return new SequenceValue(elements);
        }
        if (node.isObject()) {
            Map<String, ConfigValue> entries = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                entries.put(field.getKey(), fromJsonNode(field.getValue(), document));
            }
            return new MappingValue(entries);
        }
        throw new ConfigDecodingException(ErrorCode.MALFORMED_CONFIGURATION, document,
            "unsupported JSON node type " + node.getNodeType());
    }
    
    public JsonNode toJsonNode(ConfigValue value) {
        if (value == null || value instanceof NullValue) {
            return NODES.nullNode();
        }
        if (value instanceof BoolValue b) {
            return NODES.booleanNode(b.value());
        }
        if (value instanceof NumberValue n) {
            return NODES.numberNode(n.value());
        }
        if (value instanceof StringValue s) {
            return NODES.textNode(s.value());
        }
        if (value instanceof SequenceValue seq) {
            ArrayNode array = NODES.arrayNode(seq.size());
            seq.elements().forEach(element -> array.add(toJsonNode(element)));
            return array;
        }
        MappingValue mapping = (MappingValue) value;
        ObjectNode object = NODES.objectNode();
        mapping.entries().forEach((key, entry) -> object.set(key, toJsonNode(entry)));
        return object;
    }
    
    /**
     * Compact JSON text for a value.
     */
    public String toJson(ConfigValue value) {
        try {
            return objectMapper.writeValueAsString(toJsonNode(value));
        } catch (JsonProcessingException e) {
            throw new ConfigDecodingException(ErrorCode.SERIALIZATION_ERROR, "rendered", e.getOriginalMessage());
        }
    }
    
    /**
     * Human-readable rendering used in narratives.
     * Strings are printed bare, absent values as {@code <none>}, everything else as compact JSON.
     */
    public String render(ConfigValue value) {
        if (value == null) {
            return ABSENT;
        }
        if (value instanceof StringValue s) {
            return s.value();
        }
        if (value instanceof SequenceValue || value instanceof MappingValue) {
            return toJson(value);
        }
        return value.toString();
    }
}
