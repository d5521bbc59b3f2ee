package io.vena.chronicle.gson;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;
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
import java.math.BigInteger;
import java.util.ArrayList;
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
 * Provides JSON serialization/deserialization of {@link SerializedDocument}s using Gson.
 *
 * <p>
 * Plain JSON numbers are read back as {@link Integer}, {@link Long} or {@link BigInteger},
 * whichever is the smallest that holds the value, or as {@link Double} if they
 * have a fraction or exponent. Tagged numbers keep their exact text.
 */
public final class GsonPlugin {

	@SuppressWarnings({ "unchecked", "rawtypes" })
	public TypeAdapterFactory adapters() {
		return new TypeAdapterFactory() {
			@Override
			public TypeAdapter create(Gson gson, TypeToken typeToken) {
				TypeAdapter result = getTypeAdapter(gson, typeToken);
				// Gson requires adapters to tolerate nulls
				return (result == null) ? null : result.nullSafe();
			}

			private TypeAdapter getTypeAdapter(Gson gson, TypeToken typeToken) {
				Class theClass = typeToken.getRawType();
				if (SerializedDocument.class.isAssignableFrom(theClass)) {
					return documentAdapter(gson.getAdapter(JsonElement.class));
				} else if (Identifier.class.isAssignableFrom(theClass)) {
					return identifierAdapter();
				} else {
					return null;
				}
			}
		};
	}

	private static TypeAdapter<SerializedDocument> documentAdapter(TypeAdapter<JsonElement> treeAdapter) {
		return new TypeAdapter<SerializedDocument>() {
			@Override
			public void write(JsonWriter out, SerializedDocument value) throws IOException {
				// Null properties carry meaning, so they must be written even if Gson is configured otherwise
				boolean serializeNulls = out.getSerializeNulls();
				out.setSerializeNulls(true);
				try {
					writeDocument(value, out);
				} finally {
					out.setSerializeNulls(serializeNulls);
				}
			}

			@Override
			public SerializedDocument read(JsonReader in) throws IOException {
				return readDocument(treeAdapter.read(in));
			}
		};
	}

	private static TypeAdapter<Identifier> identifierAdapter() {
		return new TypeAdapter<Identifier>() {
			@Override
			public void write(JsonWriter out, Identifier value) throws IOException {
				out.value(value.toString());
			}

			@Override
			public Identifier read(JsonReader in) throws IOException {
				return Identifier.from(in.nextString());
			}
		};
	}

	//
	// Writing
	//

	static void writeDocument(SerializedDocument document, JsonWriter out) throws IOException {
		out.beginObject();
		out.name(OBJECTS);
		out.beginArray();
		for (ObjectRecord record: document.objects()) {
			writeRecord(record, out);
		}
		out.endArray();
		out.name(ROOTS);
		out.beginArray();
		for (Identifier root: document.roots()) {
			out.value(root.toString());
		}
		out.endArray();
		out.endObject();
	}

	private static void writeRecord(ObjectRecord record, JsonWriter out) throws IOException {
		out.beginObject();
		out.name(RECORD_TYPE).value(record.type());
		out.name(RECORD_ID).value(record.id().toString());
		out.name(RECORD_PROPERTIES);
		writeFields(record.properties(), out);
		out.endObject();
	}

	private static void writeFields(Map<String, SerializedNode> fields, JsonWriter out) throws IOException {
		out.beginObject();
		for (Map.Entry<String, SerializedNode> entry: fields.entrySet()) {
			out.name(entry.getKey());
			writeNode(entry.getValue(), out);
		}
		out.endObject();
	}

	private static void writeNode(SerializedNode node, JsonWriter out) throws IOException {
		if (node instanceof ScalarNode) {
			Object value = ((ScalarNode) node).value();
			if (value == null) {
				out.nullValue();
			} else if (value instanceof String) {
				out.value((String) value);
			} else if (value instanceof Boolean) {
				out.value((Boolean) value);
			} else {
				out.value((Number) value);
			}
		} else if (node instanceof ObjectRecord) {
			writeRecord((ObjectRecord) node, out);
		} else if (node instanceof ReferenceNode) {
			out.beginObject();
			out.name(REF).value(((ReferenceNode) node).id().toString());
			out.endObject();
		} else if (node instanceof ExactNumberNode) {
			ExactNumberNode number = (ExactNumberNode) node;
			out.beginObject();
			out.name(TYPE_TAG).value(number.kind().tag());
			out.name(VALUE).value(number.text());
			out.endObject();
		} else if (node instanceof TemporalNode) {
			TemporalNode temporal = (TemporalNode) node;
			out.beginObject();
			out.name(TYPE_TAG).value(temporal.kind().tag());
			out.name(ISO).value(temporal.iso());
			out.endObject();
		} else if (node instanceof SequenceNode) {
			out.beginArray();
			for (SerializedNode element: ((SequenceNode) node).elements()) {
				writeNode(element, out);
			}
			out.endArray();
		} else if (node instanceof MappingNode) {
			out.beginObject();
			out.name(TYPE_TAG).value(MAP_TAG);
			out.name(ENTRIES);
			writeFields(((MappingNode) node).entries(), out);
			out.endObject();
		} else {
			throw new IllegalArgumentException("Unexpected node type: " + node.getClass().getSimpleName());
		}
	}

	//
	// Reading
	//

	static SerializedDocument readDocument(JsonElement tree) {
		if (tree == null || !tree.isJsonObject()) {
			throw new DeserializationException("Document must be a JSON object");
		}
		JsonObject document = tree.getAsJsonObject();
		JsonArray objects = requiredArray(document, OBJECTS);
		JsonArray roots = requiredArray(document, ROOTS);
		List<ObjectRecord> records = new ArrayList<>(objects.size());
		for (JsonElement element: objects) {
			if (!element.isJsonObject()) {
				throw new DeserializationException("Each entry in \"" + OBJECTS + "\" must be an object");
			}
			records.add(readRecord(element.getAsJsonObject()));
		}
		List<Identifier> rootIds = new ArrayList<>(roots.size());
		for (JsonElement element: roots) {
			rootIds.add(identifier(element, "root"));
		}
		return new SerializedDocument(records, rootIds);
	}

	private static ObjectRecord readRecord(JsonObject object) {
		JsonElement type = required(object, RECORD_TYPE, "record");
		JsonElement id = required(object, RECORD_ID, "record");
		JsonElement properties = required(object, RECORD_PROPERTIES, "record");
		if (!isString(type)) {
			throw new DeserializationException("Record \"" + RECORD_TYPE + "\" must be a string");
		}
		if (!properties.isJsonObject()) {
			throw new DeserializationException("Record \"" + RECORD_PROPERTIES + "\" must be an object");
		}
		return new ObjectRecord(type.getAsString(), identifier(id, "record"), fields(properties.getAsJsonObject()));
	}

	private static Map<String, SerializedNode> fields(JsonObject object) {
		Map<String, SerializedNode> result = new LinkedHashMap<>();
		for (Map.Entry<String, JsonElement> field: object.entrySet()) {
			result.put(field.getKey(), readNode(field.getValue()));
		}
		return result;
	}

	private static SerializedNode readNode(JsonElement element) {
		if (element.isJsonNull()) {
			return ScalarNode.NULL;
		} else if (element.isJsonPrimitive()) {
			JsonPrimitive primitive = element.getAsJsonPrimitive();
			if (primitive.isBoolean()) {
				return ScalarNode.of(primitive.getAsBoolean());
			} else if (primitive.isNumber()) {
				return ScalarNode.of(number(primitive.getAsString()));
			} else {
				return ScalarNode.of(primitive.getAsString());
			}
		} else if (element.isJsonArray()) {
			JsonArray array = element.getAsJsonArray();
			List<SerializedNode> elements = new ArrayList<>(array.size());
			for (JsonElement member: array) {
				elements.add(readNode(member));
			}
			return new SequenceNode(elements);
		} else {
			return readTaggedObject(element.getAsJsonObject());
		}
	}

	private static SerializedNode readTaggedObject(JsonObject object) {
		if (object.has(REF)) {
			return new ReferenceNode(identifier(object.get(REF), "reference"));
		} else if (object.has(TYPE_TAG)) {
			JsonElement tag = object.get(TYPE_TAG);
			if (!isString(tag)) {
				throw new DeserializationException("\"" + TYPE_TAG + "\" must be a string");
			}
			switch (tag.getAsString()) {
				case DATE_TAG:
					return new TemporalNode(TemporalNode.Kind.DATE, isoText(object));
				case DATETIME_TAG:
					return new TemporalNode(TemporalNode.Kind.DATETIME, isoText(object));
				case MAP_TAG:
					JsonElement entries = required(object, ENTRIES, "map");
					if (!entries.isJsonObject()) {
						throw new DeserializationException("Map \"" + ENTRIES + "\" must be an object");
					}
					return new MappingNode(fields(entries.getAsJsonObject()));
				default:
					ExactNumberNode.Kind kind = ExactNumberNode.Kind.forTag(tag.getAsString());
					if (kind == null) {
						throw new DeserializationException("Unknown " + TYPE_TAG + " \"" + tag.getAsString() + "\"");
					}
					return new ExactNumberNode(kind, numberText(object));
			}
		} else if (object.has(RECORD_TYPE) && object.has(RECORD_ID) && object.has(RECORD_PROPERTIES)) {
			return readRecord(object);
		} else {
			throw new DeserializationException("Unrecognized object with fields " + object.keySet());
		}
	}

	/**
	 * Gson defers number parsing, so we pick the type ourselves from the text.
	 */
	static Number number(String text) {
		try {
			if (text.indexOf('.') >= 0 || text.indexOf('e') >= 0 || text.indexOf('E') >= 0) {
				return Double.parseDouble(text);
			}
			BigInteger value = new BigInteger(text);
			if (value.bitLength() < 32) {
				return value.intValue();
			} else if (value.bitLength() < 64) {
				return value.longValue();
			} else {
				return value;
			}
		} catch (NumberFormatException e) {
			throw new DeserializationException("Invalid number \"" + text + "\"", e);
		}
	}

	private static String isoText(JsonObject object) {
		JsonElement iso = required(object, ISO, "temporal value");
		if (!isString(iso)) {
			throw new DeserializationException("\"" + ISO + "\" must be a string");
		}
		return iso.getAsString();
	}

	private static String numberText(JsonObject object) {
		JsonElement value = required(object, VALUE, "number");
		if (!isString(value)) {
			throw new DeserializationException("Number \"" + VALUE + "\" must be a string");
		}
		return value.getAsString();
	}

	private static Identifier identifier(JsonElement element, String context) {
		if (!isString(element)) {
			throw new DeserializationException("Expected string identifier for " + context);
		}
		try {
			return Identifier.from(element.getAsString());
		} catch (IllegalArgumentException e) {
			throw new DeserializationException("Invalid identifier for " + context + ": \"" + element.getAsString() + "\"", e);
		}
	}

	private static boolean isString(JsonElement element) {
		return element != null && element.isJsonPrimitive() && element.getAsJsonPrimitive().isString();
	}

	private static JsonElement required(JsonObject object, String fieldName, String context) {
		JsonElement result = object.get(fieldName);
		if (result == null) {
			throw new DeserializationException("Missing \"" + fieldName + "\" field in " + context);
		}
		return result;
	}

	private static JsonArray requiredArray(JsonObject object, String fieldName) {
		JsonElement result = required(object, fieldName, "document");
		if (!result.isJsonArray()) {
			throw new DeserializationException("\"" + fieldName + "\" must be an array");
		}
		return result.getAsJsonArray();
	}

}
