package io.vena.chronicle.serialization;

/**
 * Field names and tags of the JSON document layout shared by every codec.
 *
 * <pre>
 * {
 *   "objects": [ {"type": "Document", "id": "...", "properties": { ... }} ],
 *   "roots": [ "..." ]
 * }
 * </pre>
 *
 * Inside <code>properties</code>, JSON scalars and arrays stand for themselves;
 * objects are distinguished by their keys:
 * <code>{"$ref": id}</code> is a {@link ReferenceNode},
 * <code>{"__type__": "date" | "datetime", "iso": ...}</code> is a {@link TemporalNode},
 * <code>{"__type__": "long" | "short" | "byte" | "float" | "bigint" | "decimal", "value": "..."}</code> is an {@link ExactNumberNode},
 * <code>{"__type__": "map", "entries": {...}}</code> is a {@link MappingNode},
 * and an object with <code>type</code>, <code>id</code> and <code>properties</code> is a nested {@link ObjectRecord}.
 */
public final class DocumentFormat {
	public static final String OBJECTS = "objects";
	public static final String ROOTS = "roots";

	public static final String RECORD_TYPE = "type";
	public static final String RECORD_ID = "id";
	public static final String RECORD_PROPERTIES = "properties";

	public static final String REF = "$ref";

	public static final String TYPE_TAG = "__type__";
	public static final String ISO = "iso";
	public static final String DATE_TAG = "date";
	public static final String DATETIME_TAG = "datetime";
	public static final String MAP_TAG = "map";
	public static final String LONG_TAG = "long";
	public static final String SHORT_TAG = "short";
	public static final String BYTE_TAG = "byte";
	public static final String FLOAT_TAG = "float";
	public static final String BIGINT_TAG = "bigint";
	public static final String DECIMAL_TAG = "decimal";
	public static final String VALUE = "value";
	public static final String ENTRIES = "entries";

	private DocumentFormat() {}
}
