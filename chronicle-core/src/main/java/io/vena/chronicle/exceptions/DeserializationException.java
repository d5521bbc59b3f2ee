package io.vena.chronicle.exceptions;

/**
 * The serialized form can't be turned back into an object graph.
 * Deserialization is all-or-nothing, so no objects from the failed
 * document are returned or registered.
 */
public class DeserializationException extends RuntimeException {
	public DeserializationException(String message) {
		super(message);
	}

	public DeserializationException(String message, Throwable cause) {
		super(message, cause);
	}

	public DeserializationException(Throwable cause) {
		super(cause);
	}
}
