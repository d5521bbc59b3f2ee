package io.vena.chronicle.serialization;

import io.vena.chronicle.Identifier;
import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Points at an {@link ObjectRecord} that appears elsewhere in the same document.
 */
@Value
@Accessors(fluent = true)
public class ReferenceNode implements SerializedNode {
	Identifier id;
}
