package io.vena.chronicle.serialization;

import io.vena.chronicle.Identifier;
import java.util.ArrayList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.experimental.Accessors;

import static java.util.Collections.unmodifiableList;

/**
 * A whole persisted object graph: top-level records, plus the identifiers of
 * the roots in the order they were serialized.
 *
 * <p>
 * Every root has its record either in {@link #objects} or nested inside
 * another record. Codecs such as <code>JacksonDocumentCodec</code> turn this
 * into text; {@link SerializationManager} turns it into live objects.
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
public final class SerializedDocument {
	private final List<ObjectRecord> objects;
	private final List<Identifier> roots;

	public SerializedDocument(List<ObjectRecord> objects, List<Identifier> roots) {
		this.objects = unmodifiableList(new ArrayList<>(objects));
		this.roots = unmodifiableList(new ArrayList<>(roots));
	}

	@Override
	public String toString() {
		return "SerializedDocument{roots=" + roots + ", objects=" + objects + "}";
	}
}
