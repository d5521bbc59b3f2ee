package io.vena.chronicle.gson;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonIOException;
import com.google.gson.JsonParseException;
import io.vena.chronicle.exceptions.DeserializationException;
import io.vena.chronicle.serialization.DocumentCodec;
import io.vena.chronicle.serialization.SerializedDocument;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link DocumentCodec} backed by a {@link Gson} with the
 * {@link GsonPlugin#adapters() chronicle adapters} registered.
 */
@Accessors(fluent = true)
public final class GsonDocumentCodec implements DocumentCodec {
	@Getter private final Gson gson;

	public GsonDocumentCodec() {
		this(new GsonBuilder().setPrettyPrinting().disableHtmlEscaping());
	}

	/**
	 * @param builder is modified by having the chronicle adapters registered with it
	 */
	public GsonDocumentCodec(GsonBuilder builder) {
		this.gson = builder
			.registerTypeAdapterFactory(new GsonPlugin().adapters())
			.create();
	}

	@Override
	public String write(SerializedDocument document) {
		return gson.toJson(document, SerializedDocument.class);
	}

	@Override
	public SerializedDocument read(String text) {
		try {
			return checked(gson.fromJson(text, SerializedDocument.class));
		} catch (JsonParseException e) {
			throw deserializationFailure(e);
		}
	}

	/**
	 * Leaves <code>out</code> open.
	 */
	@Override
	public void write(SerializedDocument document, Writer out) throws IOException {
		try {
			gson.toJson(document, SerializedDocument.class, out);
		} catch (JsonIOException e) {
			throw ioFailure(e);
		}
	}

	@Override
	public SerializedDocument read(Reader in) throws IOException {
		try {
			return checked(gson.fromJson(in, SerializedDocument.class));
		} catch (JsonIOException e) {
			throw ioFailure(e);
		} catch (JsonParseException e) {
			throw deserializationFailure(e);
		}
	}

	private static SerializedDocument checked(SerializedDocument result) {
		if (result == null) {
			throw new DeserializationException("Document is empty");
		}
		return result;
	}

	private static DeserializationException deserializationFailure(JsonParseException e) {
		LOGGER.debug("Unable to parse document", e);
		return new DeserializationException("Unable to parse document: " + e.getMessage(), e);
	}

	private static IOException ioFailure(JsonIOException e) {
		if (e.getCause() instanceof IOException) {
			return (IOException) e.getCause();
		} else {
			return new IOException(e);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(GsonDocumentCodec.class);
}
