package com.stagegraph.definition.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * YAML reading shared by the manifest and script parsers. Documents are read into a
 * {@link JsonNode} tree first so the schema can be checked before any field is used.
 * JSON input is accepted as well (JSON is a YAML subset).
 */
final class YamlDocuments {

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private YamlDocuments() {
    }

    /**
     * Parses {@code text} into a tree. Malformed YAML or a document that is not a mapping is
     * reported as a {@link DefinitionParseException} with a single root-level violation.
     */
    static JsonNode readDocument(String text, String documentKind) {
        if (text == null || text.isBlank()) {
            throw new DefinitionParseException(documentKind,
                    List.of(new SchemaViolation("", "document is empty")));
        }
        JsonNode root;
        try {
            root = YAML.readTree(text);
        } catch (JsonProcessingException e) {
            throw new DefinitionParseException(documentKind,
                    List.of(new SchemaViolation("", "malformed YAML: " + e.getOriginalMessage())), e);
        }
        if (root == null || !root.isObject()) {
            throw new DefinitionParseException(documentKind,
                    List.of(new SchemaViolation("", "document must be a mapping")));
        }
        return root;
    }

    /** Object node → insertion-ordered map; null/missing → empty map. */
    static Map<String, Object> toMap(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return new LinkedHashMap<>();
        return YAML.convertValue(node, MAP_TYPE);
    }

    /** Text of a scalar field, or {@code defaultValue} when absent or null. Numbers are rendered as text. */
    static String text(JsonNode parent, String field, String defaultValue) {
        JsonNode value = parent.get(field);
        if (value == null || value.isNull()) return defaultValue;
        return value.asText();
    }

    static boolean bool(JsonNode parent, String field, boolean defaultValue) {
        JsonNode value = parent.get(field);
        if (value == null || value.isNull()) return defaultValue;
        return value.asBoolean(defaultValue);
    }

    /** List of strings; a single scalar becomes a one-element list; absent/null → {@code null}. */
    static List<String> stringListOrNull(JsonNode parent, String field) {
        JsonNode value = parent.get(field);
        if (value == null || value.isNull()) return null;
        List<String> out = new ArrayList<>();
        if (value.isArray()) {
            value.forEach(item -> out.add(item.asText()));
        } else {
            out.add(value.asText());
        }
        return out;
    }

    static List<String> stringList(JsonNode parent, String field) {
        List<String> list = stringListOrNull(parent, field);
        return list != null ? list : List.of();
    }
}
