package io.vena.chronicle.serialization;

import io.vena.chronicle.Identifier;
import io.vena.chronicle.IdentityRegistry;
import io.vena.chronicle.Observable;
import io.vena.chronicle.exceptions.DanglingReferenceException;
import io.vena.chronicle.exceptions.DeserializationException;
import io.vena.chronicle.exceptions.SerializationTypeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Arrays.asList;
import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;

/**
 * Converts graphs of {@link Observable}s to and from {@link SerializedDocument}s.
 *
 * <p>
 * Serialization is a single depth-first pass. The first time an object is
 * encountered, it is written as a full {@link ObjectRecord}; every later
 * encounter in the same document is written as a {@link ReferenceNode}.
 * This is what lets shared and cyclic references survive a round trip.
 *
 * <p>
 * Deserialization is two-phase. First, every record in the document is
 * instantiated, empty, using its type's registered factory. Then every
 * record's properties are resolved, with references pointing at the
 * instances from the first phase, and applied. The new objects are
 * registered in the {@link IdentityRegistry} only once both phases succeed.
 */
@Accessors(fluent = true)
@RequiredArgsConstructor
public final class SerializationManager {
	@Getter private final SerializationRegistry types;
	@Getter private final IdentityRegistry identities;

	public SerializedDocument serialize(Observable... roots) {
		return serialize(asList(roots));
	}

	/**
	 * Objects without identifiers are registered in the {@link IdentityRegistry}
	 * as a side effect, so that they keep the same identifier in every
	 * document they are saved to.
	 *
	 * @throws SerializationTypeException if an object's type isn't registered,
	 * or a property holds a value that can't be serialized, such as a non-finite
	 * number or an enum inside a list or map
	 * @throws IllegalStateException if two distinct objects in the graph have the same identifier
	 */
	public SerializedDocument serialize(@NotNull List<? extends Observable> roots) {
		Serializer serializer = new Serializer();
		List<ObjectRecord> objects = new ArrayList<>();
		List<Identifier> rootIds = new ArrayList<>();
		for (Observable root: roots) {
			requireNonNull(root, "Roots can't be null");
			SerializedNode node = serializer.observableNode(root);
			if (node instanceof ObjectRecord) {
				objects.add((ObjectRecord) node);
			}
			rootIds.add(root.id());
		}
		LOGGER.debug("Serialized {} objects from {} roots", serializer.emitted.size(), rootIds.size());
		return new SerializedDocument(objects, rootIds);
	}

	/**
	 * @return the roots, in document order
	 * @throws SerializationTypeException if the document names an unregistered type
	 * @throws DanglingReferenceException if a reference or root has no matching record
	 * @throws DeserializationException if the document is otherwise invalid
	 */
	public List<Observable> deserialize(@NotNull SerializedDocument document) {
		Deserializer deserializer = new Deserializer();
		for (ObjectRecord record: document.objects()) {
			deserializer.create(record);
		}
		deserializer.records.forEach(deserializer::resolve);
		List<Observable> roots = new ArrayList<>(document.roots().size());
		for (Identifier rootId: document.roots()) {
			roots.add(deserializer.instance(rootId));
		}
		deserializer.created.values().forEach(identities::rebind);
		LOGGER.debug("Deserialized {} objects with {} roots", deserializer.created.size(), roots.size());
		return unmodifiableList(roots);
	}

	/**
	 * Convenience for documents with a single root of a known type.
	 *
	 * @throws DeserializationException if the document doesn't have exactly one root,
	 * or if it isn't a <code>type</code>
	 */
	public <T extends Observable> T deserializeRoot(SerializedDocument document, Class<T> type) {
		if (document.roots().size() != 1) {
			throw new DeserializationException("Expected exactly one root; found " + document.roots().size());
		}
		Observable root = deserialize(document).get(0);
		if (type.isInstance(root)) {
			return type.cast(root);
		} else {
			throw new DeserializationException("Expected " + type.getSimpleName() + " root; found " + root.getClass().getSimpleName());
		}
	}

	private final class Serializer {
		final Map<Identifier, Observable> emitted = new LinkedHashMap<>();

		SerializedNode observableNode(Observable observable) {
			Identifier id = observable.hasId() ? observable.id() : identities.register(observable);
			Observable previous = emitted.get(id);
			if (previous == observable) {
				return new ReferenceNode(id);
			} else if (previous != null) {
				throw new IllegalStateException("Two distinct objects have identifier " + id + ": " + previous + " and " + observable);
			}
			TypeRegistration<?> registration = types.registrationFor(observable);
			// Mark before recursing so cycles become references
			emitted.put(id, observable);
			Map<String, SerializedNode> properties = new LinkedHashMap<>();
			registration.propertiesOf(observable).forEach((name, value) ->
				properties.put(name, valueNode(value, observable, name, false)));
			return new ObjectRecord(registration.name(), id, properties);
		}

		/**
		 * @param isElement true inside a list or map, where there is no declared type to restore an enum from
		 */
		SerializedNode valueNode(Object value, Observable owner, String propertyName, boolean isElement) {
			if (value == null) {
				return ScalarNode.NULL;
			} else if (value instanceof Double && !Double.isFinite((Double) value)
				|| value instanceof Float && !Float.isFinite((Float) value)) {
				throw new SerializationTypeException("Can't serialize non-finite number "
					+ value + " in " + owner + "." + propertyName);
			} else if (ExactNumberNode.isExact(value)) {
				return ExactNumberNode.of((Number) value);
			} else if (ScalarNode.isScalar(value)) {
				return ScalarNode.of(value);
			} else if (value instanceof Enum) {
				if (isElement) {
					throw new SerializationTypeException("Enum " + value.getClass().getSimpleName()
						+ " can't be stored inside a collection; " + owner + "." + propertyName + " contains " + value);
				}
				return ScalarNode.of(((Enum<?>) value).name());
			} else if (value instanceof LocalDate) {
				return TemporalNode.of((LocalDate) value);
			} else if (value instanceof LocalDateTime) {
				return TemporalNode.of((LocalDateTime) value);
			} else if (value instanceof Observable) {
				return observableNode((Observable) value);
			} else if (value instanceof List) {
				List<SerializedNode> elements = new ArrayList<>();
				for (Object element: (List<?>) value) {
					elements.add(valueNode(element, owner, propertyName, true));
				}
				return new SequenceNode(elements);
			} else if (value instanceof Map) {
				Map<String, SerializedNode> entries = new LinkedHashMap<>();
				for (Map.Entry<?, ?> entry: ((Map<?, ?>) value).entrySet()) {
					if (!(entry.getKey() instanceof String)) {
						throw new SerializationTypeException("Map keys must be strings; "
							+ owner + "." + propertyName + " has key " + entry.getKey());
					}
					entries.put((String) entry.getKey(), valueNode(entry.getValue(), owner, propertyName, true));
				}
				return new MappingNode(entries);
			} else {
				throw new SerializationTypeException("Can't serialize "
					+ value.getClass().getName() + " in " + owner + "." + propertyName);
			}
		}
	}

	private final class Deserializer {
		final Map<Identifier, Observable> created = new LinkedHashMap<>();
		final Map<Identifier, ObjectRecord> records = new LinkedHashMap<>();

		void create(ObjectRecord record) {
			Identifier id = record.id();
			if (created.containsKey(id)) {
				throw new DeserializationException("Duplicate record for identifier " + id);
			}
			TypeRegistration<?> registration = types.registrationFor(record.type());
			Observable instance = registration.factory().get();
			if (instance == null) {
				throw new DeserializationException("Factory for \"" + record.type() + "\" returned null");
			}
			try {
				instance.assignId(id);
			} catch (IllegalStateException e) {
				throw new DeserializationException("Factory for \"" + record.type() + "\" returned an object that already has an identifier", e);
			}
			created.put(id, instance);
			records.put(id, record);
			record.properties().values().forEach(this::createNested);
		}

		private void createNested(SerializedNode node) {
			if (node instanceof ObjectRecord) {
				create((ObjectRecord) node);
			} else if (node instanceof SequenceNode) {
				((SequenceNode) node).elements().forEach(this::createNested);
			} else if (node instanceof MappingNode) {
				((MappingNode) node).entries().values().forEach(this::createNested);
			}
		}

		void resolve(Identifier id, ObjectRecord record) {
			Observable instance = created.get(id);
			Map<String, Object> properties = new LinkedHashMap<>();
			record.properties().forEach((name, node) -> properties.put(name, value(node)));
			TypeRegistration<?> registration = types.registrationFor(record.type());
			try {
				registration.apply(instance, properties);
			} catch (IllegalArgumentException | ClassCastException e) {
				throw new DeserializationException("Unable to apply properties to " + record.type() + "(" + id + ")", e);
			}
		}

		Object value(SerializedNode node) {
			if (node instanceof ScalarNode) {
				return ((ScalarNode) node).value();
			} else if (node instanceof ExactNumberNode) {
				return ((ExactNumberNode) node).toNumber();
			} else if (node instanceof TemporalNode) {
				return ((TemporalNode) node).toTemporal();
			} else if (node instanceof ReferenceNode) {
				return instance(((ReferenceNode) node).id());
			} else if (node instanceof ObjectRecord) {
				return created.get(((ObjectRecord) node).id());
			} else if (node instanceof SequenceNode) {
				List<Object> result = new ArrayList<>();
				for (SerializedNode element: ((SequenceNode) node).elements()) {
					result.add(value(element));
				}
				return result;
			} else if (node instanceof MappingNode) {
				Map<String, Object> result = new LinkedHashMap<>();
				((MappingNode) node).entries().forEach((key, entry) -> result.put(key, value(entry)));
				return result;
			} else {
				throw new DeserializationException("Unexpected node: " + node);
			}
		}

		Observable instance(Identifier id) {
			Observable result = created.get(id);
			if (result == null) {
				throw new DanglingReferenceException(id, "No record for identifier " + id);
			}
			return result;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SerializationManager.class);
}
