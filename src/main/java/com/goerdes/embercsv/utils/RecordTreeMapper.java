package com.goerdes.embercsv.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.goerdes.embercsv.exception.FileProcessingException;
import com.goerdes.embercsv.model.MappingNode;
import com.goerdes.embercsv.model.RecordNode;
import com.goerdes.embercsv.model.ScalarNode;
import com.goerdes.embercsv.model.SequenceNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts Jackson trees into {@link RecordNode} trees, keeping object key order.
 */
public class RecordTreeMapper {

    private RecordTreeMapper() {
    }

    public static RecordNode toRecordNode(JsonNode node) {
        if (node.isObject()) {
            Map<String, RecordNode> entries = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                entries.put(field.getKey(), toRecordNode(field.getValue()));
            }
            return new MappingNode(entries);
        }
        if (node.isArray()) {
            List<RecordNode> elements = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                elements.add(toRecordNode(element));
            }
            return new SequenceNode(elements);
        }
        if (node.isNull() || node.isMissingNode()) {
            return ScalarNode.NULL;
        }
        if (node.isNumber()) {
            return ScalarNode.of(node.numberValue());
        }
        if (node.isBoolean()) {
            return ScalarNode.of(node.booleanValue());
        }
        if (node.isTextual()) {
            return ScalarNode.of(node.textValue());
        }
        throw new FileProcessingException("Unsupported JSON node type: " + node.getNodeType(), null);
    }

    /**
     * Converts a Jackson tree whose root must be an object.
     *
     * @throws FileProcessingException if the root is not an object
     */
    public static MappingNode toMappingNode(JsonNode node) {
        if (toRecordNode(node) instanceof MappingNode mapping) {
            return mapping;
        }
        throw new FileProcessingException("Expected a JSON object but got " + node.getNodeType(), null);
    }
}
