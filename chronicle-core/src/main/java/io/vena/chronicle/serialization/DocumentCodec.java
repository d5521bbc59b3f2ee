package io.vena.chronicle.serialization;

import io.vena.chronicle.exceptions.DeserializationException;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;

/**
 * Converts {@link SerializedDocument}s to and from text in the layout
 * described by {@link DocumentFormat}.
 */
public interface DocumentCodec {
	String write(SerializedDocument document);

	/**
	 * @throws DeserializationException if the text is malformed or isn't a valid document
	 */
	SerializedDocument read(String text);

	void write(SerializedDocument document, Writer out) throws IOException;

	/**
	 * @throws DeserializationException if the text is malformed or isn't a valid document
	 */
	SerializedDocument read(Reader in) throws IOException;
}
