package io.vena.chronicle.serialization;

import io.vena.chronicle.Observable;
import java.util.Map;

/**
 * Extracts the values to persist for one {@link Observable} type.
 *
 * <p>
 * Values may be anything {@link SerializationManager} supports, including
 * other Observables; the manager takes care of turning those into records
 * or references.
 */
@FunctionalInterface
public interface ObservableSerializer<T extends Observable> {
	/**
	 * @return property values in the order they should be written
	 */
	Map<String, Object> propertiesOf(T observable);
}
