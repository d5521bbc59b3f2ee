package io.vena.chronicle.serialization;

import io.vena.chronicle.Observable;
import java.util.Map;
import java.util.function.Supplier;
import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Everything {@link SerializationManager} needs to know about one
 * {@link Observable} type.
 *
 * @param <T> the registered type
 */
@Value
@Accessors(fluent = true)
public class TypeRegistration<T extends Observable> {
	/**
	 * Stored in each {@link ObjectRecord}. Must stay stable for the lifetime
	 * of any persisted documents, even if the Java class is renamed.
	 */
	String name;
	Class<T> type;

	/**
	 * Creates an empty instance, with no identifier, during the first
	 * phase of deserialization.
	 */
	Supplier<? extends T> factory;
	ObservableSerializer<? super T> serializer;
	ObservableDeserializer<? super T> deserializer;

	Map<String, Object> propertiesOf(Observable observable) {
		return serializer.propertiesOf(type.cast(observable));
	}

	void apply(Observable observable, Map<String, Object> properties) {
		deserializer.apply(type.cast(observable), properties);
	}
}
