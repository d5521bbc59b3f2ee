package io.vena.chronicle.serialization;

import java.math.BigDecimal;
import java.math.BigInteger;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import lombok.experimental.Accessors;
import org.jetbrains.annotations.Nullable;

/**
 * Null, a {@link String}, a {@link Boolean}, or a finite {@link Number}.
 * Enums are stored as their name string.
 * Numbers other than {@link Integer} and {@link Double} are normally stored
 * as {@link ExactNumberNode}s instead, since JSON can't tell them apart.
 */
@Value
@Accessors(fluent = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ScalarNode implements SerializedNode {
	@Nullable Object value;

	public static final ScalarNode NULL = new ScalarNode(null);

	public static ScalarNode of(@Nullable Object value) {
		if (value == null) {
			return NULL;
		} else if (value instanceof Double && !Double.isFinite((Double) value)
			|| value instanceof Float && !Float.isFinite((Float) value)) {
			throw new IllegalArgumentException("Not a finite number: " + value);
		} else if (isScalar(value)) {
			return new ScalarNode(value);
		} else {
			throw new IllegalArgumentException("Not a scalar: " + value.getClass().getSimpleName());
		}
	}

	public static boolean isScalar(Object value) {
		return value instanceof String
			|| value instanceof Boolean
			|| isSupportedNumber(value);
	}

	static boolean isSupportedNumber(Object value) {
		return value instanceof Integer
			|| value instanceof Long
			|| value instanceof Short
			|| value instanceof Byte
			|| value instanceof Double
			|| value instanceof Float
			|| value instanceof BigDecimal
			|| value instanceof BigInteger;
	}

	public boolean isNull() {
		return value == null;
	}
}
