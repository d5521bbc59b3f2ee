package io.vena.chronicle.exceptions;

/**
 * A type name, class, or value has no registered or built-in serialization.
 * When this happens during deserialization, the whole document is rejected.
 */
public class SerializationTypeException extends RuntimeException {
	public SerializationTypeException(String message) { super(message); }
	public SerializationTypeException(String message, Throwable cause) { super(message, cause); }
	public SerializationTypeException(Throwable cause) { super(cause); }
}
