package io.vena.chronicle.jackson;

import io.vena.chronicle.serialization.DocumentCodec;
import io.vena.chronicle.serialization.SerializedDocument;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Saves and loads {@link SerializedDocument}s as UTF-8 files.
 *
 * <p>
 * {@link #save} writes to a temporary file in the same directory and then
 * moves it into place, so a reader never sees a partially written document.
 */
@Accessors(fluent = true)
@RequiredArgsConstructor
public final class DocumentFile {
	@Getter private final DocumentCodec codec;

	public DocumentFile() {
		this(new JacksonDocumentCodec());
	}

	public void save(Path path, SerializedDocument document) throws IOException {
		Path target = path.toAbsolutePath();
		Path temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
		try {
			try (Writer out = Files.newBufferedWriter(temp, UTF_8)) {
				codec.write(document, out);
			}
			Files.move(temp, target, ATOMIC_MOVE, REPLACE_EXISTING);
		} finally {
			Files.deleteIfExists(temp);
		}
		LOGGER.debug("Saved {} objects to {}", document.objects().size(), target);
	}

	/**
	 * @throws io.vena.chronicle.exceptions.DeserializationException if the file doesn't contain a valid document
	 */
	public SerializedDocument load(Path path) throws IOException {
		try (Reader in = Files.newBufferedReader(path, UTF_8)) {
			SerializedDocument result = codec.read(in);
			LOGGER.debug("Loaded {} objects from {}", result.objects().size(), path);
			return result;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(DocumentFile.class);
}
