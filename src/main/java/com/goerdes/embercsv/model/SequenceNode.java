package com.goerdes.embercsv.model;

import java.util.List;

/**
 * A JSON array.
 *
 * @param elements the array elements in order
 */
public record SequenceNode(List<RecordNode> elements) implements RecordNode {

    public SequenceNode {
        elements = List.copyOf(elements);
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

}
