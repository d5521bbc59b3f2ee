package io.vena.chronicle.serialization;

import io.vena.chronicle.Observable;
import io.vena.chronicle.exceptions.SerializationTypeException;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Collections.unmodifiableSet;
import static java.util.Objects.requireNonNull;

/**
 * Maps stable type names to the factories, serializers and deserializers
 * of {@link Observable} types.
 *
 * <p>
 * Stored documents only ever name registered types, so loading a document
 * can instantiate nothing but the classes the application registered here.
 *
 * <p>
 * Safe to use from multiple threads, though registration is normally done
 * once at startup.
 */
public final class SerializationRegistry {
	private final Map<String, TypeRegistration<?>> byName = new ConcurrentHashMap<>();
	private final Map<Class<?>, TypeRegistration<?>> byType = new ConcurrentHashMap<>();

	/**
	 * Registers a type that uses the schema-driven serializer and deserializer:
	 * every declared property is persisted, and properties missing from a record keep their defaults.
	 */
	public <T extends Observable> TypeRegistration<T> registerType(String name, Class<T> type, Supplier<? extends T> factory) {
		return registerType(name, type, factory, SchemaSerialization.serializer(type), SchemaSerialization.deserializer());
	}

	public <T extends Observable> TypeRegistration<T> registerType(
		@NotNull String name,
		@NotNull Class<T> type,
		@NotNull Supplier<? extends T> factory,
		@NotNull ObservableSerializer<? super T> serializer,
		@NotNull ObservableDeserializer<? super T> deserializer
	) {
		return register(new TypeRegistration<>(
			requireNonNull(name),
			requireNonNull(type),
			requireNonNull(factory),
			requireNonNull(serializer),
			requireNonNull(deserializer)));
	}

	/**
	 * @throws IllegalArgumentException if the name or the class is already registered
	 */
	public synchronized <T extends Observable> TypeRegistration<T> register(@NotNull TypeRegistration<T> registration) {
		if (registration.name().isEmpty()) {
			throw new IllegalArgumentException("Type name can't be empty");
		} else if (byName.containsKey(registration.name())) {
			throw new IllegalArgumentException("Type name \"" + registration.name() + "\" is already registered for " + byName.get(registration.name()).type().getSimpleName());
		} else if (byType.containsKey(registration.type())) {
			throw new IllegalArgumentException(registration.type().getSimpleName() + " is already registered as \"" + byType.get(registration.type()).name() + "\"");
		}
		byName.put(registration.name(), registration);
		byType.put(registration.type(), registration);
		LOGGER.debug("Registered {} as \"{}\"", registration.type().getSimpleName(), registration.name());
		return registration;
	}

	/**
	 * @throws SerializationTypeException if no type is registered under <code>name</code>
	 */
	public TypeRegistration<?> registrationFor(String name) {
		TypeRegistration<?> result = byName.get(name);
		if (result == null) {
			throw new SerializationTypeException("Unknown type name \"" + name + "\"");
		}
		return result;
	}

	/**
	 * The registration for the object's own class if there is one;
	 * otherwise for its nearest registered superclass.
	 *
	 * @throws SerializationTypeException if neither the class nor any superclass is registered
	 */
	public TypeRegistration<?> registrationFor(Observable observable) {
		for (Class<?> c = observable.getClass(); c != null && c != Object.class; c = c.getSuperclass()) {
			TypeRegistration<?> result = byType.get(c);
			if (result != null) {
				return result;
			}
		}
		throw new SerializationTypeException("No registered type for " + observable.getClass().getName());
	}

	/**
	 * @throws SerializationTypeException as for {@link #registrationFor(Observable)}
	 */
	public String typeNameFor(Observable observable) {
		return registrationFor(observable).name();
	}

	public boolean isRegistered(String name) {
		return byName.containsKey(name);
	}

	public Set<String> typeNames() {
		return unmodifiableSet(byName.keySet());
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SerializationRegistry.class);
}
