package com.goerdes.embercsv.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A JSON object. Entries keep the order in which they appeared in the source document.
 *
 * @param entries key/value pairs in document order
 */
public record MappingNode(Map<String, RecordNode> entries) implements RecordNode {

    public MappingNode {
        entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    /**
     * Direct, non-recursive lookup of a key in this object.
     */
    public Optional<RecordNode> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

}
