package io.vena.chronicle.serialization;

import java.util.ArrayList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.experimental.Accessors;

import static java.util.Collections.unmodifiableList;

@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
public final class SequenceNode implements SerializedNode {
	private final List<SerializedNode> elements;

	public SequenceNode(List<? extends SerializedNode> elements) {
		this.elements = unmodifiableList(new ArrayList<>(elements));
	}

	@Override
	public String toString() {
		return elements.toString();
	}
}
