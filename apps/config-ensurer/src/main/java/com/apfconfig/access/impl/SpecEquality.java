package com.apfconfig.access.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Iterator;
import java.util.Map;

// null, false, 0, "" and empty collections all count as unset
final class SpecEquality {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private SpecEquality() {
    }

    static boolean semanticallyEqual(Object expected, Object actual) {
        return normalize(expected).equals(normalize(actual));
    }

    static JsonNode normalize(Object value) {
        if (value == null) {
            return MissingNode.getInstance();
        }
        JsonNode tree = MAPPER.valueToTree(value);
        return tree == null ? MissingNode.getInstance() : prune(tree);
    }

    private static JsonNode prune(JsonNode node) {
        if (node.isNull() || node.isMissingNode()) {
            return MissingNode.getInstance();
        }
        if (node.isTextual() && node.asText().isEmpty()) {
            return MissingNode.getInstance();
        }
        if (node.isBoolean() && !node.booleanValue()) {
            return MissingNode.getInstance();
        }
        if (node.isNumber() && node.decimalValue().signum() == 0) {
            return MissingNode.getInstance();
        }
        if (node.isObject()) {
            ObjectNode pruned = JsonNodeFactory.instance.objectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode child = prune(field.getValue());
                if (!child.isMissingNode()) {
                    pruned.set(field.getKey(), child);
                }
            }
            return pruned.isEmpty() ? MissingNode.getInstance() : pruned;
        }
        if (node.isArray()) {
            if (node.isEmpty()) {
                return MissingNode.getInstance();
            }
            ArrayNode pruned = JsonNodeFactory.instance.arrayNode();
            for (JsonNode element : node) {
                JsonNode child = prune(element);
                pruned.add(child.isMissingNode() ? NullNode.getInstance() : child);
            }
            return pruned;
        }
        return node;
    }
}
