package io.vena.chronicle.jackson;

import io.vena.chronicle.exceptions.DeserializationException;
import io.vena.chronicle.serialization.SerializedDocument;
import io.vena.chronicle.testing.DocumentCodecConformanceTest;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Collections.emptyList;
import static java.util.Collections.singletonList;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DocumentFileTest {
	@TempDir Path dir;
	DocumentFile file;

	@BeforeEach
	void setupFile() {
		file = new DocumentFile();
	}

	@Test
	void saveThenLoad() throws IOException {
		Path path = dir.resolve("doc.json");
		SerializedDocument expected = DocumentCodecConformanceTest.referenceDocument();
		file.save(path, expected);
		assertEquals(expected, file.load(path));
	}

	@Test
	void save_replacesExistingFile() throws IOException {
		Path path = dir.resolve("doc.json");
		Files.write(path, "stale".getBytes(UTF_8));
		SerializedDocument empty = new SerializedDocument(emptyList(), emptyList());
		file.save(path, empty);
		assertEquals(empty, file.load(path));
	}

	@Test
	void save_leavesNoTemporaryFiles() throws IOException {
		file.save(dir.resolve("doc.json"), DocumentCodecConformanceTest.referenceDocument());
		assertEquals(singletonList("doc.json"), fileNames());
	}

	@Test
	void load_missingFile_throws() {
		assertThrows(NoSuchFileException.class, () -> file.load(dir.resolve("absent.json")));
	}

	@Test
	void load_corruptFile_throws() throws IOException {
		Path path = dir.resolve("corrupt.json");
		Files.write(path, "{\"objects\": [".getBytes(UTF_8));
		assertThrows(DeserializationException.class, () -> file.load(path));
	}

	private List<String> fileNames() throws IOException {
		try (Stream<Path> files = Files.list(dir)) {
			return files.map(p -> p.getFileName().toString()).collect(Collectors.toList());
		}
	}
}
