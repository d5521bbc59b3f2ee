package io.vena.chronicle.serialization;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.experimental.Accessors;

import static java.util.Collections.unmodifiableMap;

/**
 * A map with string keys. Entry order is preserved.
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
public final class MappingNode implements SerializedNode {
	private final Map<String, SerializedNode> entries;

	public MappingNode(Map<String, ? extends SerializedNode> entries) {
		this.entries = unmodifiableMap(new LinkedHashMap<>(entries));
	}

	@Override
	public String toString() {
		return entries.toString();
	}
}
