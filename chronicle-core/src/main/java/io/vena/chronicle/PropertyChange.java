package io.vena.chronicle;

import lombok.Value;
import lombok.experimental.Accessors;
import org.jetbrains.annotations.Nullable;

/**
 * Describes one effective write to a property: the old and new values are never equal.
 */
@Value
@Accessors(fluent = true)
public class PropertyChange {
	Observable source;
	String propertyName;
	@Nullable Object oldValue;
	@Nullable Object newValue;

	@Override
	public String toString() {
		return source.getClass().getSimpleName() + "." + propertyName + ": " + oldValue + " -> " + newValue;
	}
}
