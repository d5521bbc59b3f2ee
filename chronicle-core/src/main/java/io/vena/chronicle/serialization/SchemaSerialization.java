package io.vena.chronicle.serialization;

import io.vena.chronicle.Observable;
import io.vena.chronicle.ObservableProperty;
import io.vena.chronicle.ObservableSchema;
import io.vena.chronicle.exceptions.DeserializationException;
import io.vena.chronicle.exceptions.SerializationTypeException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The serializer and deserializer used for types registered without custom ones.
 * They persist every property declared by the type's {@link ObservableSchema}.
 */
final class SchemaSerialization {
	private SchemaSerialization() {}

	/**
	 * An object saved under a registered superclass only gets the properties of
	 * that superclass's schema, since those are all a loaded instance can hold.
	 *
	 * @throws SerializationTypeException if the object's schema doesn't extend
	 * any schema of <code>registeredType</code>
	 */
	static <T extends Observable> ObservableSerializer<T> serializer(Class<T> registeredType) {
		return observable -> {
			ObservableSchema schema;
			try {
				schema = observable.schema().narrowedTo(registeredType);
			} catch (IllegalArgumentException e) {
				throw new SerializationTypeException("Can't save " + observable.getClass().getSimpleName()
					+ " as " + registeredType.getSimpleName(), e);
			}
			Map<String, Object> result = new LinkedHashMap<>();
			for (ObservableProperty<?> property: schema.properties()) {
				result.put(property.name(), observable.get(property.name()));
			}
			return result;
		};
	}

	/**
	 * Properties absent from the record keep their defaults.
	 */
	static <T extends Observable> ObservableDeserializer<T> deserializer() {
		return (observable, properties) -> {
			properties.forEach((name, value) -> {
				if (!observable.schema().hasProperty(name)) {
					throw new DeserializationException(observable.getClass().getSimpleName() + " has no property \"" + name + "\"");
				}
				ObservableProperty<?> property = observable.schema().property(name);
				observable.set(name, coerce(property, value));
			});
		};
	}

	/**
	 * Enums are stored as strings, and hand-written documents may hold plain
	 * JSON numbers where the property declares some other numeric type.
	 */
	static Object coerce(ObservableProperty<?> property, Object value) {
		Class<?> type = property.type();
		if (value == null || type.isInstance(value)) {
			return value;
		} else if (value instanceof Number) {
			return coerceNumber(property, (Number) value);
		} else if (value instanceof String && type.isEnum()) {
			return enumValue(property, (String) value);
		} else {
			throw new DeserializationException("Property " + property + " can't hold " + value.getClass().getSimpleName() + " " + value);
		}
	}

	private static Object coerceNumber(ObservableProperty<?> property, Number value) {
		Class<?> type = property.type();
		if (type == Double.class) {
			return value.doubleValue();
		} else if (type == Float.class) {
			return value.floatValue();
		} else if (type == Number.class) {
			return value;
		}
		try {
			BigDecimal decimal = new BigDecimal(value.toString());
			if (type == Integer.class) {
				return decimal.intValueExact();
			} else if (type == Long.class) {
				return decimal.longValueExact();
			} else if (type == Short.class) {
				return decimal.shortValueExact();
			} else if (type == Byte.class) {
				return decimal.byteValueExact();
			} else if (type == BigInteger.class) {
				return decimal.toBigIntegerExact();
			} else if (type == BigDecimal.class) {
				return decimal;
			}
		} catch (ArithmeticException | NumberFormatException e) {
			throw new DeserializationException("Property " + property + " can't hold number " + value, e);
		}
		throw new DeserializationException("Property " + property + " can't hold number " + value);
	}

	@SuppressWarnings({"unchecked", "rawtypes"})
	private static Object enumValue(ObservableProperty<?> property, String name) {
		try {
			return Enum.valueOf((Class<? extends Enum>) property.type(), name);
		} catch (IllegalArgumentException e) {
			throw new DeserializationException("Property " + property + " has no constant \"" + name + "\"", e);
		}
	}
}
