package io.vena.chronicle.serialization;

import io.vena.chronicle.exceptions.DeserializationException;
import io.vena.chronicle.exceptions.SerializationTypeException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.function.Function;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.experimental.Accessors;
import org.jetbrains.annotations.Nullable;

/**
 * A number whose Java type and exact value must survive a trip through JSON,
 * which only distinguishes integers from doubles.
 * The value is kept as text so no codec has a chance to round it.
 *
 * <p>
 * {@link Integer} and finite {@link Double} values don't need this;
 * they're stored as plain {@link ScalarNode}s.
 */
@Value
@Accessors(fluent = true)
public class ExactNumberNode implements SerializedNode {
	Kind kind;
	String text;

	/**
	 * @throws SerializationTypeException if <code>value</code> is a non-finite {@link Float}
	 * or isn't one of the types in {@link Kind}
	 */
	public static ExactNumberNode of(Number value) {
		Kind kind = Kind.of(value);
		if (value instanceof Float && !Float.isFinite((Float) value)) {
			throw new SerializationTypeException("Can't serialize non-finite number " + value);
		}
		if (value instanceof BigDecimal) {
			return new ExactNumberNode(kind, ((BigDecimal) value).toString());
		} else {
			return new ExactNumberNode(kind, value.toString());
		}
	}

	public static boolean isExact(Object value) {
		return value instanceof Long
			|| value instanceof Short
			|| value instanceof Byte
			|| value instanceof Float
			|| value instanceof BigInteger
			|| value instanceof BigDecimal;
	}

	/**
	 * @throws DeserializationException if {@link #text} isn't valid for {@link #kind}
	 */
	public Number toNumber() {
		try {
			Number result = kind.parser.apply(text);
			if (result instanceof Float && !Float.isFinite((Float) result)) {
				throw new DeserializationException("Non-finite " + kind.tag() + " \"" + text + "\"");
			}
			return result;
		} catch (NumberFormatException e) {
			throw new DeserializationException("Invalid " + kind.tag() + " \"" + text + "\"", e);
		}
	}

	@Getter
	@Accessors(fluent = true)
	@RequiredArgsConstructor
	public enum Kind {
		LONG(DocumentFormat.LONG_TAG, Long::valueOf),
		SHORT(DocumentFormat.SHORT_TAG, Short::valueOf),
		BYTE(DocumentFormat.BYTE_TAG, Byte::valueOf),
		FLOAT(DocumentFormat.FLOAT_TAG, Float::valueOf),
		BIGINT(DocumentFormat.BIGINT_TAG, BigInteger::new),
		DECIMAL(DocumentFormat.DECIMAL_TAG, BigDecimal::new),
		;

		/**
		 * The value of {@link DocumentFormat#TYPE_TAG} in stored documents.
		 */
		private final String tag;
		@Getter(AccessLevel.NONE)
		private final Function<String, Number> parser;

		static Kind of(Number value) {
			if (value instanceof Long) {
				return LONG;
			} else if (value instanceof Short) {
				return SHORT;
			} else if (value instanceof Byte) {
				return BYTE;
			} else if (value instanceof Float) {
				return FLOAT;
			} else if (value instanceof BigInteger) {
				return BIGINT;
			} else if (value instanceof BigDecimal) {
				return DECIMAL;
			} else {
				throw new SerializationTypeException("No exact form for " + value.getClass().getSimpleName());
			}
		}

		/**
		 * @return the kind with the given {@link #tag}, or null if there is none
		 */
		public static @Nullable Kind forTag(String tag) {
			for (Kind kind: values()) {
				if (kind.tag.equals(tag)) {
					return kind;
				}
			}
			return null;
		}
	}
}
