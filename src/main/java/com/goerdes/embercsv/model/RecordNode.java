package com.goerdes.embercsv.model;

/**
 * A node of a decoded record tree. Every node is exactly one of
 * {@link ScalarNode}, {@link MappingNode} or {@link SequenceNode}.
 */
public sealed interface RecordNode permits ScalarNode, MappingNode, SequenceNode {
}
