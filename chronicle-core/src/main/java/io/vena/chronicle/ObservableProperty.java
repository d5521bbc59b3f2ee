package io.vena.chronicle;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import org.jetbrains.annotations.Nullable;

/**
 * Declares one named, typed slot of an {@link Observable} type.
 *
 * <p>
 * Properties are declared once per concrete type, typically as
 * <code>static final</code> constants, and gathered into that type's
 * {@link ObservableSchema}. The value itself lives in each instance.
 *
 * <pre>
 * public static final ObservableProperty&lt;String&gt; TITLE = ObservableProperty.of("title", String.class, "");
 * </pre>
 *
 * @param <T> the type of value held by the property. Must not be primitive;
 *           values may be null.
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class ObservableProperty<T> {
	private final String name;
	private final Class<T> type;
	private final @Nullable T defaultValue;

	public static <V> ObservableProperty<V> of(String name, Class<V> type, @Nullable V defaultValue) {
		if (name.isEmpty()) {
			throw new IllegalArgumentException("Property name can't be empty");
		} else if (type.isPrimitive()) {
			throw new IllegalArgumentException("Property \"" + name + "\" must use a wrapper type instead of " + type);
		} else if (defaultValue != null && !type.isInstance(defaultValue)) {
			throw new IllegalArgumentException("Default value of property \"" + name + "\" is not a " + type.getSimpleName());
		}
		return new ObservableProperty<>(name, type, defaultValue);
	}

	public static <V> ObservableProperty<V> of(String name, Class<V> type) {
		return of(name, type, null);
	}

	public boolean accepts(@Nullable Object value) {
		return value == null || type.isInstance(value);
	}

	@Override
	public String toString() {
		return name + ":" + type.getSimpleName();
	}
}
