package io.vena.chronicle;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import static java.util.UUID.randomUUID;

/**
 * The stable identity of an {@link Observable}, and of observer subscriptions.
 * Identifiers are what persisted documents use to express references,
 * so they survive a save/load round trip unchanged.
 */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
@EqualsAndHashCode
public final class Identifier {
	@NonNull final String value;

	public static Identifier from(String value) {
		if (value.isEmpty()) {
			throw new IllegalArgumentException("Identifier can't be empty");
		} else if (value.startsWith("-") || value.endsWith("-")) {
			throw new IllegalArgumentException("Identifier can't start or end with a hyphen");
		}
		return new Identifier(value);
	}

	/**
	 * @return a globally unique identifier suitable for a newly created object.
	 */
	public static Identifier random() {
		return new Identifier(randomUUID().toString());
	}

	/**
	 * Unique within this process only. Good enough for subscriptions, which are never persisted.
	 */
	public static synchronized Identifier unique(String prefix) {
		return new Identifier(prefix + (++uniqueIdCounter));
	}

	private static long uniqueIdCounter = 1000;

	@Override public String toString() { return value; }
}
