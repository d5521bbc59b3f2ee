package io.vena.chronicle.serialization;

import io.vena.chronicle.Identifier;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.experimental.Accessors;

import static java.util.Collections.unmodifiableMap;

/**
 * The full serialized state of one {@link io.vena.chronicle.Observable}:
 * its registered type name, its identifier, and its property values
 * in schema order.
 *
 * <p>
 * Appears either in {@link SerializedDocument#objects()} or nested
 * inside another record's properties, wherever the object was first
 * encountered.
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
public final class ObjectRecord implements SerializedNode {
	private final String type;
	private final Identifier id;
	private final Map<String, SerializedNode> properties;

	public ObjectRecord(String type, Identifier id, Map<String, ? extends SerializedNode> properties) {
		this.type = type;
		this.id = id;
		this.properties = unmodifiableMap(new LinkedHashMap<>(properties));
	}

	@Override
	public String toString() {
		return type + "(" + id + ")" + properties;
	}
}
