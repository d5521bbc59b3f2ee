package io.vena.chronicle.serialization;

import io.vena.chronicle.Observable;
import io.vena.chronicle.exceptions.DeserializationException;
import java.util.Map;

/**
 * Applies persisted values to a freshly created {@link Observable}.
 *
 * <p>
 * By the time this is called, every object in the document exists, so
 * <code>properties</code> can contain references to any of them, including
 * objects whose own properties haven't been applied yet.
 */
@FunctionalInterface
public interface ObservableDeserializer<T extends Observable> {
	/**
	 * @throws DeserializationException if the values don't fit the object
	 */
	void apply(T observable, Map<String, Object> properties);
}
