package io.vena.chronicle.testing;

import io.vena.chronicle.Identifier;
import io.vena.chronicle.Observable;
import io.vena.chronicle.exceptions.DanglingReferenceException;
import io.vena.chronicle.exceptions.DeserializationException;
import io.vena.chronicle.exceptions.SerializationTypeException;
import io.vena.chronicle.serialization.DocumentCodec;
import io.vena.chronicle.serialization.ExactNumberNode;
import io.vena.chronicle.serialization.MappingNode;
import io.vena.chronicle.serialization.ObjectRecord;
import io.vena.chronicle.serialization.ReferenceNode;
import io.vena.chronicle.serialization.ScalarNode;
import io.vena.chronicle.serialization.SequenceNode;
import io.vena.chronicle.serialization.SerializedDocument;
import io.vena.chronicle.serialization.SerializedNode;
import io.vena.chronicle.serialization.TemporalNode;
import io.vena.chronicle.testing.state.TestProject;
import io.vena.chronicle.testing.state.TestTask;
import io.vena.chronicle.testing.state.TestTask.Priority;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import static java.util.Arrays.asList;
import static java.util.Collections.emptyList;
import static java.util.Collections.emptyMap;
import static java.util.Collections.singletonList;
import static java.util.Collections.singletonMap;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Checks that a {@link DocumentCodec} reads and writes the document
 * layout described by {@link io.vena.chronicle.serialization.DocumentFormat},
 * and that object graphs survive the trip through text intact.
 * <p>
 *
 * Use this by extending it and supplying a value for
 * the {@link #codec} to test.
 */
public abstract class DocumentCodecConformanceTest extends AbstractCodecTest {
	// Subclass must initialize this
	protected DocumentCodec codec;

	/**
	 * Every codec must read this text as {@link #referenceDocument()}.
	 */
	public static final String REFERENCE_TEXT = "{\n"
		+ "  \"objects\": [\n"
		+ "    {\"type\": \"Project\", \"id\": \"p1\", \"properties\": {\n"
		+ "      \"name\": \"Launch\",\n"
		+ "      \"created\": {\"__type__\": \"datetime\", \"iso\": \"2024-03-01T09:30\"},\n"
		+ "      \"budget\": 5000000000,\n"
		+ "      \"tasks\": [\n"
		+ "        {\"type\": \"Task\", \"id\": \"t1\", \"properties\": {\"title\": \"Design\", \"project\": {\"$ref\": \"p1\"}}},\n"
		+ "        {\"type\": \"Task\", \"id\": \"t2\", \"properties\": {\"title\": \"Build\", \"blockedBy\": {\"$ref\": \"t1\"}, \"due\": {\"__type__\": \"date\", \"iso\": \"2024-04-15\"}}}\n"
		+ "      ],\n"
		+ "      \"attributes\": {\"__type__\": \"map\", \"entries\": {\"colour\": \"green\", \"limits\": [1, 2.5, null, true]}}\n"
		+ "    }}\n"
		+ "  ],\n"
		+ "  \"roots\": [\"p1\"]\n"
		+ "}\n";

	public static SerializedDocument referenceDocument() {
		Map<String, SerializedNode> design = new LinkedHashMap<>();
		design.put("title", ScalarNode.of("Design"));
		design.put("project", new ReferenceNode(Identifier.from("p1")));

		Map<String, SerializedNode> build = new LinkedHashMap<>();
		build.put("title", ScalarNode.of("Build"));
		build.put("blockedBy", new ReferenceNode(Identifier.from("t1")));
		build.put("due", new TemporalNode(TemporalNode.Kind.DATE, "2024-04-15"));

		Map<String, SerializedNode> attributes = new LinkedHashMap<>();
		attributes.put("colour", ScalarNode.of("green"));
		attributes.put("limits", new SequenceNode(asList(ScalarNode.of(1), ScalarNode.of(2.5), ScalarNode.NULL, ScalarNode.of(true))));

		Map<String, SerializedNode> project = new LinkedHashMap<>();
		project.put("name", ScalarNode.of("Launch"));
		project.put("created", new TemporalNode(TemporalNode.Kind.DATETIME, "2024-03-01T09:30"));
		project.put("budget", ScalarNode.of(5_000_000_000L));
		project.put("tasks", new SequenceNode(asList(
			new ObjectRecord("Task", Identifier.from("t1"), design),
			new ObjectRecord("Task", Identifier.from("t2"), build))));
		project.put("attributes", new MappingNode(attributes));

		return new SerializedDocument(
			singletonList(new ObjectRecord("Project", Identifier.from("p1"), project)),
			singletonList(Identifier.from("p1")));
	}

	@Test
	void read_referenceText() {
		assertEquals(referenceDocument(), codec.read(REFERENCE_TEXT));
	}

	@Test
	void read_referenceText_resolvesGraph() {
		TestProject project = serialization.deserializeRoot(codec.read(REFERENCE_TEXT), TestProject.class);
		TestTask design = project.tasks().get(0);
		TestTask build = project.tasks().get(1);
		assertSame(project, design.project());
		assertSame(design, build.blockedBy());
		assertEquals(Long.valueOf(5_000_000_000L), project.get(TestProject.BUDGET));
		assertEquals(LocalDateTime.of(2024, 3, 1, 9, 30), project.get(TestProject.CREATED));
		assertEquals(LocalDate.of(2024, 4, 15), build.get(TestTask.DUE));
		assertEquals(asList(1, 2.5, null, true), project.attributes().get("limits"));
	}

	@Test
	void writeThenRead_sameDocument() {
		SerializedDocument expected = referenceDocument();
		assertEquals(expected, codec.read(codec.write(expected)));
	}

	@Test
	void writeThenRead_emptyDocument() {
		SerializedDocument empty = new SerializedDocument(emptyList(), emptyList());
		assertEquals(empty, codec.read(codec.write(empty)));
	}

	@Test
	void writerAndReader() throws IOException {
		SerializedDocument expected = referenceDocument();
		StringWriter out = new StringWriter();
		codec.write(expected, out);
		assertEquals(expected, codec.read(new StringReader(out.toString())));
	}

	@Test
	void roundTrip_everyPropertyType() {
		TestTask task = TestTask.titled("Everything");
		task.set(TestTask.DONE, true);
		task.set(TestTask.PRIORITY, Priority.HIGH);
		task.set(TestTask.ESTIMATE, 8);
		task.set(TestTask.PROGRESS, 0.25);
		task.set(TestTask.WEIGHT, 2.5f);
		task.set(TestTask.COST, new BigDecimal("12.25"));
		task.set(TestTask.DUE, LocalDate.of(2024, 2, 29));
		task.set(TestTask.NOTES, Arrays.<Object>asList("a", 3, 4.5, null, false, singletonList(1), singletonMap("k", "v")));

		TestTask copy = (TestTask) throughText(codec, task).get(0);

		assertNotSame(task, copy);
		assertEquals(task.id(), copy.id());
		for (String name: TestTask.SCHEMA.propertyNames()) {
			assertEquals(task.get(name), copy.get(name), name);
		}
	}

	@Test
	void roundTrip_projectProperties() {
		TestProject project = new TestProject();
		project.name("Big");
		project.set(TestProject.CREATED, LocalDateTime.of(2023, 12, 31, 23, 59, 58));
		project.set(TestProject.BUDGET, 12L);
		Map<String, Object> attributes = new LinkedHashMap<>();
		attributes.put("huge", new BigInteger("123456789012345678901234567890"));
		attributes.put("long", 3_000_000_000L);
		attributes.put("negative", -7);
		project.attributes(attributes);

		TestProject copy = (TestProject) throughText(codec, project).get(0);

		assertEquals("Big", copy.name());
		assertEquals(project.get(TestProject.CREATED), copy.get(TestProject.CREATED));
		assertEquals(Long.valueOf(12L), copy.get(TestProject.BUDGET));
		assertEquals(attributes, copy.attributes());
	}

	@ParameterizedTest
	@ValueSource(strings = { "12.50", "0.10", "-0.000", "1E+3", "12345678901234567890.123456789" })
	void roundTrip_decimalKeepsScaleAndPrecision(String text) {
		BigDecimal cost = new BigDecimal(text);
		TestTask task = TestTask.titled("Costly");
		task.set(TestTask.COST, cost);
		task.set(TestTask.NOTES, singletonList(cost));

		TestTask copy = (TestTask) throughText(codec, task).get(0);

		assertEquals(cost.toString(), copy.get(TestTask.COST).toString());
		assertEquals(singletonList(cost), copy.get(TestTask.NOTES));
	}

	@Test
	void roundTrip_collectionsKeepNumericTypes() {
		List<Object> notes = Arrays.<Object>asList(
			3L, (short) 4, (byte) 5, 1.5f, 7, 2.5,
			new BigInteger("-98765432109876543210"),
			new BigDecimal("0.30"),
			Long.MIN_VALUE, Float.MAX_VALUE);
		Map<String, Object> attributes = new LinkedHashMap<>();
		attributes.put("small", 1L);
		attributes.put("notes", notes);
		TestTask task = TestTask.titled("Numbers");
		task.set(TestTask.NOTES, notes);
		TestProject project = new TestProject();
		project.attributes(attributes);

		List<Observable> roots = throughText(codec, task, project);
		List<Object> notes2 = ((TestTask) roots.get(0)).get(TestTask.NOTES);
		Map<String, Object> attributes2 = ((TestProject) roots.get(1)).attributes();

		assertEquals(notes, notes2);
		for (int i = 0; i < notes.size(); i++) {
			assertSame(notes.get(i).getClass(), notes2.get(i).getClass(), "notes[" + i + "]");
		}
		assertEquals(attributes, attributes2);
		assertSame(Long.class, attributes2.get("small").getClass());
	}

	@Test
	void read_exactNumbers() {
		String text = "{\"objects\": [{\"type\": \"Task\", \"id\": \"t1\", \"properties\": {\"notes\": ["
			+ "{\"__type__\": \"long\", \"value\": \"1\"}, "
			+ "{\"__type__\": \"decimal\", \"value\": \"12.50\"}, "
			+ "{\"__type__\": \"float\", \"value\": \"0.1\"}"
			+ "]}}], \"roots\": [\"t1\"]}";
		SerializedDocument expected = new SerializedDocument(
			singletonList(new ObjectRecord("Task", Identifier.from("t1"), singletonMap("notes", new SequenceNode(asList(
				new ExactNumberNode(ExactNumberNode.Kind.LONG, "1"),
				new ExactNumberNode(ExactNumberNode.Kind.DECIMAL, "12.50"),
				new ExactNumberNode(ExactNumberNode.Kind.FLOAT, "0.1")))))),
			singletonList(Identifier.from("t1")));

		SerializedDocument document = codec.read(text);

		assertEquals(expected, document);
		TestTask task = serialization.deserializeRoot(document, TestTask.class);
		assertEquals(asList(1L, new BigDecimal("12.50"), 0.1f), task.get(TestTask.NOTES));
	}

	@ParameterizedTest
	@ValueSource(strings = { "{\"__type__\": \"long\", \"value\": \"1.5\"}", "{\"__type__\": \"decimal\", \"value\": \"twelve\"}", "{\"__type__\": \"float\", \"value\": \"NaN\"}" })
	void read_badNumberText_detectedByDeserialize(String number) {
		String text = "{\"objects\": [{\"type\": \"Task\", \"id\": \"t1\", \"properties\": {\"notes\": [" + number + "]}}], \"roots\": [\"t1\"]}";
		SerializedDocument document = codec.read(text);
		assertThrows(DeserializationException.class, () -> serialization.deserialize(document));
	}

	@ParameterizedTest
	@ValueSource(doubles = { Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY })
	void write_nonFiniteDouble_throws(double progress) {
		TestTask task = TestTask.titled("Unbounded");
		task.set(TestTask.PROGRESS, progress);
		assertThrows(SerializationTypeException.class, () -> throughText(codec, task));
	}

	@Test
	void write_nonFiniteFloatInCollection_throws() {
		TestTask task = TestTask.titled("Unbounded");
		task.set(TestTask.NOTES, singletonList(Float.NaN));
		assertThrows(SerializationTypeException.class, () -> throughText(codec, task));
	}

	@Test
	void write_enumInCollection_throws() {
		TestTask task = TestTask.titled("Prioritized");
		task.set(TestTask.NOTES, Arrays.<Object>asList(3L, Priority.HIGH));
		assertThrows(SerializationTypeException.class, () -> throughText(codec, task));
	}

	@Test
	void roundTrip_sharedAndCyclicReferences() {
		TestProject project = new TestProject();
		TestTask first = TestTask.titled("first");
		TestTask second = TestTask.titled("second");
		first.project(project);
		second.project(project);
		second.blockedBy(first);
		first.blockedBy(first);
		project.tasks(asList(first, second));

		List<Observable> roots = throughText(codec, second, project);
		TestTask second2 = (TestTask) roots.get(0);
		TestProject project2 = (TestProject) roots.get(1);

		assertSame(project2, second2.project());
		assertSame(second2, project2.tasks().get(1));
		TestTask first2 = project2.tasks().get(0);
		assertSame(first2, second2.blockedBy());
		assertSame(first2, first2.blockedBy());
		assertSame(project2, first2.project());
	}

	@Test
	void roundTrip_mapsThatLookLikeOtherThings() {
		Map<String, Object> attributes = new LinkedHashMap<>();
		attributes.put("recordish", recordLikeMap());
		attributes.put("refish", singletonMap("$ref", "p1"));
		attributes.put("dateish", dateLikeMap());
		attributes.put("empty", emptyMap());
		TestProject project = new TestProject();
		project.attributes(attributes);

		TestProject copy = (TestProject) throughText(codec, project).get(0);
		assertEquals(attributes, copy.attributes());
	}

	@Test
	void roundTrip_awkwardStrings() {
		TestTask task = TestTask.titled("quote \" backslash \\ newline \n tab \t unicode 🌳 nul \u0000");
		TestTask copy = (TestTask) throughText(codec, task).get(0);
		assertEquals(task.title(), copy.title());
	}

	@ParameterizedTest
	@MethodSource("invalidText")
	void read_invalidText_throws(String text) {
		assertThrows(DeserializationException.class, () -> codec.read(text));
	}

	@Test
	void read_danglingReference_detectedByDeserialize() {
		String text = "{\"objects\": [{\"type\": \"Task\", \"id\": \"t1\", \"properties\": {\"blockedBy\": {\"$ref\": \"ghost\"}}}], \"roots\": [\"t1\"]}";
		SerializedDocument document = codec.read(text);
		Exception e = assertThrows(DeserializationException.class, () -> serialization.deserialize(document));
		assertThat(e, instanceOf(DanglingReferenceException.class));
	}

	@SuppressWarnings("unused")
	static Stream<String> invalidText() {
		return Stream.of(
			"",
			"{",
			"[]",
			"\"just a string\"",
			"{\"objects\": []}",
			"{\"roots\": []}",
			"{\"objects\": {}, \"roots\": []}",
			"{\"objects\": [], \"roots\": [1]}",
			"{\"objects\": [], \"roots\": [\"\"]}",
			"{\"objects\": [42], \"roots\": []}",
			"{\"objects\": [{\"id\": \"a\", \"properties\": {}}], \"roots\": []}",
			"{\"objects\": [{\"type\": \"Task\", \"properties\": {}}], \"roots\": []}",
			"{\"objects\": [{\"type\": \"Task\", \"id\": \"a\"}], \"roots\": []}",
			"{\"objects\": [{\"type\": \"Task\", \"id\": \"a\", \"properties\": []}], \"roots\": []}",
			"{\"objects\": [{\"type\": \"Task\", \"id\": \"a\", \"properties\": {\"x\": {\"unexpected\": 1}}}], \"roots\": []}",
			"{\"objects\": [{\"type\": \"Task\", \"id\": \"a\", \"properties\": {\"x\": {\"$ref\": 5}}}], \"roots\": []}",
			"{\"objects\": [{\"type\": \"Task\", \"id\": \"a\", \"properties\": {\"x\": {\"__type__\": \"blob\"}}}], \"roots\": []}",
			"{\"objects\": [{\"type\": \"Task\", \"id\": \"a\", \"properties\": {\"x\": {\"__type__\": \"date\"}}}], \"roots\": []}",
			"{\"objects\": [{\"type\": \"Task\", \"id\": \"a\", \"properties\": {\"x\": {\"__type__\": \"map\", \"entries\": []}}}], \"roots\": []}",
			"{\"objects\": [{\"type\": \"Task\", \"id\": \"a\", \"properties\": {\"x\": {\"__type__\": \"decimal\"}}}], \"roots\": []}",
			"{\"objects\": [{\"type\": \"Task\", \"id\": \"a\", \"properties\": {\"x\": {\"__type__\": \"decimal\", \"value\": 12.5}}}], \"roots\": []}",
			"{\"objects\": [{\"type\": \"Task\", \"id\": \"a\", \"properties\": {\"x\": {\"__type__\": \"long\", \"value\": null}}}], \"roots\": []}"
		);
	}

	private static Map<String, Object> recordLikeMap() {
		Map<String, Object> result = new LinkedHashMap<>();
		result.put("type", "Task");
		result.put("id", "t9");
		result.put("properties", emptyMap());
		return result;
	}

	private static Map<String, Object> dateLikeMap() {
		Map<String, Object> result = new LinkedHashMap<>();
		result.put("__type__", "date");
		result.put("iso", "2024-01-01");
		return result;
	}
}
