package io.vena.chronicle.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.vena.chronicle.exceptions.DeserializationException;
import io.vena.chronicle.serialization.DocumentCodec;
import io.vena.chronicle.serialization.SerializedDocument;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link DocumentCodec} backed by an {@link ObjectMapper} with the
 * {@link JacksonPlugin#module() chronicle module} registered.
 */
@Accessors(fluent = true)
public final class JacksonDocumentCodec implements DocumentCodec {
	@Getter private final ObjectMapper mapper;

	public JacksonDocumentCodec() {
		this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
	}

	/**
	 * @param mapper is modified by having the chronicle module registered with it
	 */
	public JacksonDocumentCodec(ObjectMapper mapper) {
		this.mapper = mapper.registerModule(new JacksonPlugin().module());
	}

	@Override
	public String write(SerializedDocument document) {
		try {
			return mapper.writeValueAsString(document);
		} catch (JsonProcessingException e) {
			throw new UncheckedIOException("Unable to write document", e);
		}
	}

	@Override
	public SerializedDocument read(String text) {
		try {
			return checked(mapper.readValue(text, SerializedDocument.class));
		} catch (JsonProcessingException e) {
			throw deserializationFailure(e);
		}
	}

	/**
	 * Leaves <code>out</code> open.
	 */
	@Override
	public void write(SerializedDocument document, Writer out) throws IOException {
		mapper.writerFor(SerializedDocument.class)
			.without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
			.writeValue(out, document);
	}

	@Override
	public SerializedDocument read(Reader in) throws IOException {
		try {
			return checked(mapper.readerFor(SerializedDocument.class)
				.without(JsonParser.Feature.AUTO_CLOSE_SOURCE)
				.readValue(in));
		} catch (JsonProcessingException e) {
			throw deserializationFailure(e);
		}
	}

	private static SerializedDocument checked(SerializedDocument result) {
		if (result == null) {
			throw new DeserializationException("Document can't be null");
		}
		return result;
	}

	private static DeserializationException deserializationFailure(JsonProcessingException e) {
		if (e.getCause() instanceof DeserializationException) {
			return (DeserializationException) e.getCause();
		}
		LOGGER.debug("Unable to parse document", e);
		return new DeserializationException("Unable to parse document: " + e.getOriginalMessage(), e);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JacksonDocumentCodec.class);
}
