package io.vena.chronicle.serialization;

/**
 * One value in a {@link SerializedDocument}, independent of any
 * particular storage syntax. Codecs translate these to and from JSON.
 *
 * @see ScalarNode
 * @see ExactNumberNode
 * @see TemporalNode
 * @see ReferenceNode
 * @see ObjectRecord
 * @see SequenceNode
 * @see MappingNode
 */
public interface SerializedNode {
}
