package com.goerdes.embercsv.utils;

import com.goerdes.embercsv.model.MappingNode;
import com.goerdes.embercsv.model.RecordNode;
import com.goerdes.embercsv.model.SequenceNode;

import java.util.Map;
import java.util.Optional;

public class RecordSearchUtil {

    private RecordSearchUtil() {
    }

    /**
     * Searches the record tree for the first entry whose key equals {@code key}.
     * <p>
     * The traversal is depth-first and pre-order: within a mapping each entry is
     * checked in document order, and a nested mapping, or every mapping element
     * of a nested array, is fully searched before moving on to the next sibling.
     * The first match wins, even if the same key occurs elsewhere in the tree.
     *
     * @param node the mapping to search in
     * @param key  the key to look for
     * @return the value of the first matching entry, or empty if none matched
     */
    public static Optional<RecordNode> search(MappingNode node, String key) {
        for (Map.Entry<String, RecordNode> entry : node.entries().entrySet()) {
            if (entry.getKey().equals(key)) {
                return Optional.of(entry.getValue());
            }
            Optional<RecordNode> found = searchChild(entry.getValue(), key);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    /**
     * Like {@link #search(MappingNode, String)}, but accepts any node. Scalars and
     * arrays at the top level never match since they have no keys of their own.
     */
    public static Optional<RecordNode> search(RecordNode node, String key) {
        return node instanceof MappingNode mapping ? search(mapping, key) : Optional.empty();
    }

    private static Optional<RecordNode> searchChild(RecordNode child, String key) {
        if (child instanceof MappingNode mapping) {
            return search(mapping, key);
        }
        if (child instanceof SequenceNode sequence) {
            for (RecordNode element : sequence.elements()) {
                // scalars and nested arrays inside an array are not descended into
                if (element instanceof MappingNode mapping) {
                    Optional<RecordNode> found = search(mapping, key);
                    if (found.isPresent()) {
                        return found;
                    }
                }
            }
        }
        return Optional.empty();
    }
}
