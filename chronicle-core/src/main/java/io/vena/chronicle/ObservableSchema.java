package io.vena.chronicle;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.jetbrains.annotations.Nullable;

import static java.util.Arrays.asList;
import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableSet;

/**
 * The fixed, ordered set of {@link ObservableProperty properties} of one
 * concrete {@link Observable} type. Shared by every instance of the type.
 *
 * <p>
 * Declaration order is significant: it is the order in which properties are
 * serialized.
 */
@Accessors(fluent = true)
public final class ObservableSchema {
	@Getter private final Class<? extends Observable> ownerType;
	private final @Nullable ObservableSchema parent;
	private final Map<String, ObservableProperty<?>> propertiesByName;

	private ObservableSchema(Class<? extends Observable> ownerType, @Nullable ObservableSchema parent, Map<String, ObservableProperty<?>> propertiesByName) {
		this.ownerType = ownerType;
		this.parent = parent;
		this.propertiesByName = propertiesByName;
	}

	public static ObservableSchema of(Class<? extends Observable> ownerType, ObservableProperty<?>... properties) {
		return new ObservableSchema(ownerType, null, indexByName(ownerType, new LinkedHashMap<>(), asList(properties)));
	}

	/**
	 * For a subclass of an Observable type that adds properties of its own.
	 * The parent's properties come first.
	 */
	public static ObservableSchema extending(ObservableSchema parent, Class<? extends Observable> ownerType, ObservableProperty<?>... properties) {
		if (!parent.ownerType.isAssignableFrom(ownerType)) {
			throw new IllegalArgumentException(ownerType.getSimpleName() + " does not extend " + parent.ownerType.getSimpleName());
		}
		return new ObservableSchema(ownerType, parent, indexByName(ownerType, new LinkedHashMap<>(parent.propertiesByName), asList(properties)));
	}

	/**
	 * @return the schema this one {@link #extending extends}, if any
	 */
	public Optional<ObservableSchema> parent() {
		return Optional.ofNullable(parent);
	}

	/**
	 * The most specific schema, among this one and its ancestors, that
	 * instances of <code>type</code> are guaranteed to have.
	 * This is the part of an object's state that a superclass understands.
	 *
	 * @throws IllegalArgumentException if no schema in the chain belongs to <code>type</code> or a supertype of it
	 */
	public ObservableSchema narrowedTo(Class<? extends Observable> type) {
		for (ObservableSchema candidate = this; candidate != null; candidate = candidate.parent) {
			if (candidate.ownerType.isAssignableFrom(type)) {
				return candidate;
			}
		}
		throw new IllegalArgumentException(ownerType.getSimpleName() + " schema doesn't extend any schema of " + type.getSimpleName());
	}

	private static Map<String, ObservableProperty<?>> indexByName(Class<?> ownerType, LinkedHashMap<String, ObservableProperty<?>> result, List<ObservableProperty<?>> properties) {
		for (ObservableProperty<?> property: properties) {
			ObservableProperty<?> existing = result.put(property.name(), property);
			if (existing != null) {
				throw new IllegalArgumentException("Duplicate property \"" + property.name() + "\" in " + ownerType.getSimpleName());
			}
		}
		return result;
	}

	public boolean hasProperty(String name) {
		return propertiesByName.containsKey(name);
	}

	/**
	 * @throws IllegalArgumentException if the type declares no such property
	 */
	public ObservableProperty<?> property(String name) {
		ObservableProperty<?> result = propertiesByName.get(name);
		if (result == null) {
			throw new IllegalArgumentException(ownerType.getSimpleName() + " has no property \"" + name + "\"");
		}
		return result;
	}

	/**
	 * @throws IllegalArgumentException if <code>property</code> is not the one this schema declares under its name
	 */
	@SuppressWarnings("unchecked")
	public <T> ObservableProperty<T> property(ObservableProperty<T> property) {
		ObservableProperty<?> declared = property(property.name());
		if (!declared.equals(property)) {
			throw new IllegalArgumentException(ownerType.getSimpleName() + " declares " + declared + ", not " + property);
		}
		return (ObservableProperty<T>) declared;
	}

	public List<ObservableProperty<?>> properties() {
		return unmodifiableList(new ArrayList<>(propertiesByName.values()));
	}

	public Set<String> propertyNames() {
		return unmodifiableSet(propertiesByName.keySet());
	}

	@Override
	public String toString() {
		return ownerType.getSimpleName() + propertiesByName.values();
	}
}
