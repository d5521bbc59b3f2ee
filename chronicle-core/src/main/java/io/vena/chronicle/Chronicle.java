package io.vena.chronicle;

import io.vena.chronicle.commands.Command;
import io.vena.chronicle.commands.CommandListener;
import io.vena.chronicle.commands.CommandManager;
import io.vena.chronicle.commands.CommandManagerSettings;
import io.vena.chronicle.serialization.ObservableDeserializer;
import io.vena.chronicle.serialization.ObservableSerializer;
import io.vena.chronicle.serialization.SerializationManager;
import io.vena.chronicle.serialization.SerializationRegistry;
import io.vena.chronicle.serialization.SerializedDocument;
import io.vena.chronicle.serialization.TypeRegistration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Arrays.asList;
import static java.util.Objects.requireNonNull;

/**
 * One undoable object space: a {@link CommandManager}, an {@link IdentityRegistry},
 * and the {@link SerializationManager} that saves and loads its objects.
 *
 * <p>
 * The components themselves are single-threaded. Every method here holds
 * one {@link ReentrantLock} for its duration, so a <code>Chronicle</code> can
 * be shared between threads as long as they only touch its objects through it.
 * Use {@link #locked} for anything else, such as reading several properties consistently.
 *
 * <pre>
 * Chronicle chronicle = new Chronicle("editor");
 * chronicle.registerType("Document", Document.class, Document::new);
 * chronicle.execute(new PropertyCommand(doc, Document.TITLE, "Draft"));
 * chronicle.undo();
 * List&lt;Observable&gt; roots = chronicle.load(savedDocument);
 * </pre>
 */
@Accessors(fluent = true)
public class Chronicle {
	@Getter private final String name;
	@Getter private final CommandManager commands;
	@Getter private final IdentityRegistry identities;
	@Getter private final SerializationRegistry types;
	@Getter private final SerializationManager serialization;
	private final ReentrantLock lock = new ReentrantLock();

	public Chronicle(String name) {
		this(name, CommandManagerSettings.builder().build());
	}

	public Chronicle(@NotNull String name, @NotNull CommandManagerSettings settings) {
		this.name = requireNonNull(name);
		this.commands = new CommandManager(settings);
		this.identities = new IdentityRegistry();
		this.types = new SerializationRegistry();
		this.serialization = new SerializationManager(types, identities);
		LOGGER.debug("Created chronicle \"{}\"", name);
	}

	public boolean execute(Command command) {
		return locked(() -> commands.execute(command));
	}

	public boolean undo() {
		return locked(commands::undo);
	}

	public boolean redo() {
		return locked(commands::redo);
	}

	public boolean canUndo() {
		return locked(commands::canUndo);
	}

	public boolean canRedo() {
		return locked(commands::canRedo);
	}

	public void clearHistory() {
		locked(commands::clear);
	}

	public void beginInit() {
		locked(commands::beginInit);
	}

	public void endInit() {
		locked(commands::endInit);
	}

	public void beginCompound(String compoundName) {
		locked(() -> commands.beginCompound(compoundName));
	}

	public void endCompound() {
		locked(commands::endCompound);
	}

	public void abortCompound() {
		locked(commands::abortCompound);
	}

	public void addListener(CommandListener listener) {
		commands.addListener(listener);
	}

	public boolean removeListener(CommandListener listener) {
		return commands.removeListener(listener);
	}

	public <T extends Observable> TypeRegistration<T> registerType(String typeName, Class<T> type, Supplier<? extends T> factory) {
		return types.registerType(typeName, type, factory);
	}

	public <T extends Observable> TypeRegistration<T> registerType(
		String typeName,
		Class<T> type,
		Supplier<? extends T> factory,
		ObservableSerializer<? super T> serializer,
		ObservableDeserializer<? super T> deserializer
	) {
		return types.registerType(typeName, type, factory, serializer, deserializer);
	}

	public Identifier register(Observable observable) {
		return locked(() -> identities.register(observable));
	}

	public Optional<Observable> resolve(Identifier id) {
		return locked(() -> identities.resolve(id));
	}

	public <T extends Observable> Optional<T> resolve(Identifier id, Class<T> type) {
		return locked(() -> identities.resolve(id, type));
	}

	public SerializedDocument serialize(Observable... roots) {
		return serialize(asList(roots));
	}

	public SerializedDocument serialize(List<? extends Observable> roots) {
		return locked(() -> serialization.serialize(roots));
	}

	/**
	 * Adds the document's objects without touching the command history.
	 *
	 * @see #load
	 */
	public List<Observable> deserialize(SerializedDocument document) {
		return locked(() -> serialization.deserialize(document));
	}

	/**
	 * Opens a saved document in place of whatever was being edited.
	 * The command history is cleared, because its commands target the objects being replaced.
	 * If the document can't be deserialized, the history is left alone.
	 *
	 * @return the roots, in document order
	 * @throws IllegalStateException if a command or compound is in progress
	 */
	public List<Observable> load(SerializedDocument document) {
		return locked(() -> {
			if (commands.isExecuting() || commands.isInCompound()) {
				throw new IllegalStateException("Can't load while a command or compound is in progress");
			}
			List<Observable> roots = serialization.deserialize(document);
			commands.clear();
			LOGGER.debug("Loaded {} roots into \"{}\" and cleared its history", roots.size(), name);
			return roots;
		});
	}

	/**
	 * Runs <code>action</code> while holding this chronicle's lock.
	 * The lock is reentrant, so <code>action</code> may call other methods of this object.
	 */
	public <T> T locked(Supplier<T> action) {
		lock.lock();
		try {
			return action.get();
		} finally {
			lock.unlock();
		}
	}

	public void locked(Runnable action) {
		lock.lock();
		try {
			action.run();
		} finally {
			lock.unlock();
		}
	}

	@Override
	public String toString() {
		return "Chronicle(" + name + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Chronicle.class);
}
