package io.vena.chronicle.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationConfig;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.Deserializers;
import com.fasterxml.jackson.databind.ser.Serializers;
import io.vena.chronicle.Identifier;
import io.vena.chronicle.exceptions.DeserializationException;
import io.vena.chronicle.serialization.ExactNumberNode;
import io.vena.chronicle.serialization.MappingNode;
import io.vena.chronicle.serialization.ObjectRecord;
import io.vena.chronicle.serialization.ReferenceNode;
import io.vena.chronicle.serialization.ScalarNode;
import io.vena.chronicle.serialization.SequenceNode;
import io.vena.chronicle.serialization.SerializedDocument;
import io.vena.chronicle.serialization.SerializedNode;
import io.vena.chronicle.serialization.TemporalNode;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.vena.chronicle.serialization.DocumentFormat.DATETIME_TAG;
import static io.vena.chronicle.serialization.DocumentFormat.DATE_TAG;
import static io.vena.chronicle.serialization.DocumentFormat.ENTRIES;
import static io.vena.chronicle.serialization.DocumentFormat.ISO;
import static io.vena.chronicle.serialization.DocumentFormat.MAP_TAG;
import static io.vena.chronicle.serialization.DocumentFormat.OBJECTS;
import static io.vena.chronicle.serialization.DocumentFormat.RECORD_ID;
import static io.vena.chronicle.serialization.DocumentFormat.RECORD_PROPERTIES;
import static io.vena.chronicle.serialization.DocumentFormat.RECORD_TYPE;
import static io.vena.chronicle.serialization.DocumentFormat.REF;
import static io.vena.chronicle.serialization.DocumentFormat.ROOTS;
import static io.vena.chronicle.serialization.DocumentFormat.TYPE_TAG;
import static io.vena.chronicle.serialization.DocumentFormat.VALUE;

/**
 * Provides JSON serialization/deserialization of {@link SerializedDocument}s using Jackson.
 *
 * <p>
 * Register the {@link #module()} with an <code>ObjectMapper</code>, or use
 * {@link JacksonDocumentCodec}, which does so for you.
 */
public final class JacksonPlugin {

	public ChronicleJacksonModule module() {
		return new ChronicleJacksonModule() {
			@Override
			public void setupModule(SetupContext context) {
				context.addSerializers(new ChronicleSerializers());
				context.addDeserializers(new ChronicleDeserializers());
			}
		};
	}

	private static final class ChronicleSerializers extends Serializers.Base {
		@Override
		public JsonSerializer<?> findSerializer(SerializationConfig config, JavaType type, BeanDescription beanDesc) {
			Class<?> theClass = type.getRawClass();
			if (SerializedDocument.class.isAssignableFrom(theClass)) {
				return documentSerializer();
			} else if (Identifier.class.isAssignableFrom(theClass)) {
				return identifierSerializer();
			} else {
				return null;
			}
		}

		private JsonSerializer<SerializedDocument> documentSerializer() {
			return new JsonSerializer<SerializedDocument>() {
				@Override
				public void serialize(SerializedDocument value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
					writeDocument(value, gen);
				}
			};
		}

		private JsonSerializer<Identifier> identifierSerializer() {
			return new JsonSerializer<Identifier>() {
				@Override
				public void serialize(Identifier value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
					gen.writeString(value.toString());
				}
			};
		}
	}

	private static final class ChronicleDeserializers extends Deserializers.Base {
		@Override
		public JsonDeserializer<?> findBeanDeserializer(JavaType type, DeserializationConfig config, BeanDescription beanDesc) {
			Class<?> theClass = type.getRawClass();
			if (SerializedDocument.class.isAssignableFrom(theClass)) {
				return documentDeserializer();
			} else if (Identifier.class.isAssignableFrom(theClass)) {
				return identifierDeserializer();
			} else {
				return null;
			}
		}

		private JsonDeserializer<SerializedDocument> documentDeserializer() {
			return new JsonDeserializer<SerializedDocument>() {
				@Override
				public SerializedDocument deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
					return readDocument(ctxt.readTree(p));
				}
			};
		}

		private JsonDeserializer<Identifier> identifierDeserializer() {
			return new JsonDeserializer<Identifier>() {
				@Override
				public Identifier deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
					return identifier(ctxt.readTree(p), "identifier");
				}
			};
		}
	}

	//
	// Writing
	//

	static void writeDocument(SerializedDocument document, JsonGenerator gen) throws IOException {
		gen.writeStartObject();
		gen.writeArrayFieldStart(OBJECTS);
		for (ObjectRecord record: document.objects()) {
			writeRecord(record, gen);
		}
		gen.writeEndArray();
		gen.writeArrayFieldStart(ROOTS);
		for (Identifier root: document.roots()) {
			gen.writeString(root.toString());
		}
		gen.writeEndArray();
		gen.writeEndObject();
	}

	private static void writeRecord(ObjectRecord record, JsonGenerator gen) throws IOException {
		gen.writeStartObject();
		gen.writeStringField(RECORD_TYPE, record.type());
		gen.writeStringField(RECORD_ID, record.id().toString());
		gen.writeObjectFieldStart(RECORD_PROPERTIES);
		for (Map.Entry<String, SerializedNode> entry: record.properties().entrySet()) {
			gen.writeFieldName(entry.getKey());
			writeNode(entry.getValue(), gen);
		}
		gen.writeEndObject();
		gen.writeEndObject();
	}

	private static void writeNode(SerializedNode node, JsonGenerator gen) throws IOException {
		if (node instanceof ScalarNode) {
			writeScalar(((ScalarNode) node).value(), gen);
		} else if (node instanceof ObjectRecord) {
			writeRecord((ObjectRecord) node, gen);
		} else if (node instanceof ReferenceNode) {
			gen.writeStartObject();
			gen.writeStringField(REF, ((ReferenceNode) node).id().toString());
			gen.writeEndObject();
		} else if (node instanceof ExactNumberNode) {
			ExactNumberNode number = (ExactNumberNode) node;
			gen.writeStartObject();
			gen.writeStringField(TYPE_TAG, number.kind().tag());
			gen.writeStringField(VALUE, number.text());
			gen.writeEndObject();
		} else if (node instanceof TemporalNode) {
			TemporalNode temporal = (TemporalNode) node;
			gen.writeStartObject();
			gen.writeStringField(TYPE_TAG, temporal.kind().tag());
			gen.writeStringField(ISO, temporal.iso());
			gen.writeEndObject();
		} else if (node instanceof SequenceNode) {
			gen.writeStartArray();
			for (SerializedNode element: ((SequenceNode) node).elements()) {
				writeNode(element, gen);
			}
			gen.writeEndArray();
		} else if (node instanceof MappingNode) {
			gen.writeStartObject();
			gen.writeStringField(TYPE_TAG, MAP_TAG);
			gen.writeObjectFieldStart(ENTRIES);
			for (Map.Entry<String, SerializedNode> entry: ((MappingNode) node).entries().entrySet()) {
				gen.writeFieldName(entry.getKey());
				writeNode(entry.getValue(), gen);
			}
			gen.writeEndObject();
			gen.writeEndObject();
		} else {
			throw new IllegalArgumentException("Unexpected node type: " + node.getClass().getSimpleName());
		}
	}

	private static void writeScalar(Object value, JsonGenerator gen) throws IOException {
		if (value == null) {
			gen.writeNull();
		} else if (value instanceof String) {
			gen.writeString((String) value);
		} else if (value instanceof Boolean) {
			gen.writeBoolean((Boolean) value);
		} else if (value instanceof Long) {
			gen.writeNumber((Long) value);
		} else if (value instanceof Double) {
			gen.writeNumber((Double) value);
		} else if (value instanceof Float) {
			gen.writeNumber((Float) value);
		} else if (value instanceof BigDecimal) {
			gen.writeNumber((BigDecimal) value);
		} else if (value instanceof BigInteger) {
			gen.writeNumber((BigInteger) value);
		} else {
			// Integer, Short, Byte
			gen.writeNumber(((Number) value).intValue());
		}
	}

	//
	// Reading
	//

	static SerializedDocument readDocument(JsonNode tree) {
		if (tree == null || !tree.isObject()) {
			throw new DeserializationException("Document must be a JSON object");
		}
		JsonNode objects = required(tree, OBJECTS, "document");
		JsonNode roots = required(tree, ROOTS, "document");
		if (!objects.isArray()) {
			throw new DeserializationException("\"" + OBJECTS + "\" must be an array");
		}
		if (!roots.isArray()) {
			throw new DeserializationException("\"" + ROOTS + "\" must be an array");
		}
		List<ObjectRecord> records = new ArrayList<>(objects.size());
		for (JsonNode element: objects) {
			if (!element.isObject()) {
				throw new DeserializationException("Each entry in \"" + OBJECTS + "\" must be an object");
			}
			records.add(readRecord(element));
		}
		List<Identifier> rootIds = new ArrayList<>(roots.size());
		for (JsonNode element: roots) {
			rootIds.add(identifier(element, "root"));
		}
		return new SerializedDocument(records, rootIds);
	}

	private static ObjectRecord readRecord(JsonNode node) {
		JsonNode type = required(node, RECORD_TYPE, "record");
		JsonNode id = required(node, RECORD_ID, "record");
		JsonNode properties = required(node, RECORD_PROPERTIES, "record");
		if (!type.isTextual()) {
			throw new DeserializationException("Record \"" + RECORD_TYPE + "\" must be a string");
		}
		if (!properties.isObject()) {
			throw new DeserializationException("Record \"" + RECORD_PROPERTIES + "\" must be an object");
		}
		return new ObjectRecord(type.textValue(), identifier(id, "record"), fields(properties));
	}

	private static Map<String, SerializedNode> fields(JsonNode object) {
		Map<String, SerializedNode> result = new LinkedHashMap<>();
		Iterator<Map.Entry<String, JsonNode>> iter = object.fields();
		while (iter.hasNext()) {
			Map.Entry<String, JsonNode> field = iter.next();
			result.put(field.getKey(), readNode(field.getValue()));
		}
		return result;
	}

	private static SerializedNode readNode(JsonNode node) {
		if (node.isNull()) {
			return ScalarNode.NULL;
		} else if (node.isTextual()) {
			return ScalarNode.of(node.textValue());
		} else if (node.isBoolean()) {
			return ScalarNode.of(node.booleanValue());
		} else if (node.isIntegralNumber()) {
			// IntNode, LongNode or BigIntegerNode, whichever is the smallest that fits
			return ScalarNode.of(node.numberValue());
		} else if (node.isNumber()) {
			return ScalarNode.of(node.doubleValue());
		} else if (node.isArray()) {
			List<SerializedNode> elements = new ArrayList<>(node.size());
			for (JsonNode element: node) {
				elements.add(readNode(element));
			}
			return new SequenceNode(elements);
		} else if (node.isObject()) {
			return readTaggedObject(node);
		} else {
			throw new DeserializationException("Unexpected JSON node: " + node.getNodeType());
		}
	}

	private static SerializedNode readTaggedObject(JsonNode node) {
		if (node.has(REF)) {
			return new ReferenceNode(identifier(node.get(REF), "reference"));
		} else if (node.has(TYPE_TAG)) {
			JsonNode tag = node.get(TYPE_TAG);
			if (!tag.isTextual()) {
				throw new DeserializationException("\"" + TYPE_TAG + "\" must be a string");
			}
			switch (tag.textValue()) {
				case DATE_TAG:
					return new TemporalNode(TemporalNode.Kind.DATE, isoText(node));
				case DATETIME_TAG:
					return new TemporalNode(TemporalNode.Kind.DATETIME, isoText(node));
				case MAP_TAG:
					JsonNode entries = required(node, ENTRIES, "map");
					if (!entries.isObject()) {
						throw new DeserializationException("Map \"" + ENTRIES + "\" must be an object");
					}
					return new MappingNode(fields(entries));
				default:
					ExactNumberNode.Kind kind = ExactNumberNode.Kind.forTag(tag.textValue());
					if (kind == null) {
						throw new DeserializationException("Unknown " + TYPE_TAG + " \"" + tag.textValue() + "\"");
					}
					return new ExactNumberNode(kind, numberText(node));
			}
		} else if (node.has(RECORD_TYPE) && node.has(RECORD_ID) && node.has(RECORD_PROPERTIES)) {
			return readRecord(node);
		} else {
			throw new DeserializationException("Unrecognized object with fields " + fieldNames(node));
		}
	}

	private static String isoText(JsonNode node) {
		JsonNode iso = required(node, ISO, "temporal value");
		if (!iso.isTextual()) {
			throw new DeserializationException("\"" + ISO + "\" must be a string");
		}
		return iso.textValue();
	}

	private static String numberText(JsonNode node) {
		JsonNode value = required(node, VALUE, "number");
		if (!value.isTextual()) {
			throw new DeserializationException("Number \"" + VALUE + "\" must be a string");
		}
		return value.textValue();
	}

	private static Identifier identifier(JsonNode node, String context) {
		if (node == null || !node.isTextual()) {
			throw new DeserializationException("Expected string identifier for " + context);
		}
		try {
			return Identifier.from(node.textValue());
		} catch (IllegalArgumentException e) {
			throw new DeserializationException("Invalid identifier for " + context + ": \"" + node.textValue() + "\"", e);
		}
	}

	private static JsonNode required(JsonNode object, String fieldName, String context) {
		JsonNode result = object.get(fieldName);
		if (result == null) {
			throw new DeserializationException("Missing \"" + fieldName + "\" field in " + context);
		}
		return result;
	}

	private static List<String> fieldNames(JsonNode object) {
		List<String> result = new ArrayList<>();
		object.fieldNames().forEachRemaining(result::add);
		return result;
	}

}
