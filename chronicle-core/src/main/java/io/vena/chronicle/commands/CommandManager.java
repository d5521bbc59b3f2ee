package io.vena.chronicle.commands;

import io.vena.chronicle.commands.CommandManagerSettings.ErrorPolicy;
import io.vena.chronicle.exceptions.ReentrantExecutionException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Runs commands and records them in a {@link CommandHistory}.
 *
 * <p>
 * Three recording modes:
 * <ol><li>
 *     Normal: each successfully executed command becomes one history entry.
 * </li><li>
 *     Init ({@link #beginInit}): commands run but aren't recorded. Used while
 *     building up state that the user should not be able to undo.
 *     Takes precedence over compound mode.
 * </li><li>
 *     Compound ({@link #beginCompound}): commands run and accumulate into a
 *     single {@link CompoundCommand} that becomes one history entry at the
 *     outermost {@link #endCompound}.
 * </li></ol>
 *
 * Both modes nest: only the outermost end leaves the mode.
 *
 * <p>
 * While a command's execute, undo or redo is in progress, any further
 * execute, undo or redo on the same manager throws {@link ReentrantExecutionException}.
 * Commands that need to do several things should be written as a {@link CompoundCommand}.
 *
 * <p>
 * Not thread-safe. See {@link io.vena.chronicle.Chronicle} for a locked façade.
 */
@Accessors(fluent = true)
public class CommandManager {
	@Getter private final CommandManagerSettings settings;
	@Getter private final CommandHistory history;
	private final List<CommandListener> listeners = new CopyOnWriteArrayList<>();

	private @Nullable Command running = null;
	private int initDepth = 0;
	private int compoundDepth = 0;
	private @Nullable CompoundCommand pendingCompound = null;

	public CommandManager() {
		this(CommandManagerSettings.builder().build());
	}

	public CommandManager(@NotNull CommandManagerSettings settings) {
		this.settings = requireNonNull(settings);
		this.history = new CommandHistory(settings.history());
	}

	/**
	 * @return true if the command executed successfully; false if it failed
	 * and the {@link ErrorPolicy} is {@link ErrorPolicy#LOG LOG}.
	 * @throws ReentrantExecutionException if called while another command is running
	 * @throws RuntimeException whatever the command threw, if the {@link ErrorPolicy} is {@link ErrorPolicy#PROPAGATE PROPAGATE}
	 */
	public boolean execute(@NotNull Command command) {
		requireNonNull(command);
		checkNotRunning("execute", command);
		notifyListeners(l -> l.beforeExecute(command));
		RuntimeException failure = runGuarded(command, command::execute);
		if (failure != null) {
			notifyListeners(l -> l.afterExecute(command, false));
			return handleFailure("Execute", command, failure);
		}
		record(command);
		notifyListeners(l -> l.afterExecute(command, true));
		return true;
	}

	private void record(Command command) {
		if (initDepth > 0) {
			LOGGER.trace("Not recording \"{}\" during init", command.name());
		} else if (compoundDepth > 0) {
			pendingCompound.add(command);
		} else {
			history.add(command);
		}
	}

	/**
	 * @return true if a command was undone; false if there was nothing to undo,
	 * or the undo failed and the {@link ErrorPolicy} is {@link ErrorPolicy#LOG LOG}.
	 * @throws IllegalStateException if a compound is open
	 */
	public boolean undo() {
		checkNotRunning("undo", null);
		checkNoCompound("undo");
		Command command = history.peekUndo().orElse(null);
		if (command == null) {
			return false;
		}
		notifyListeners(l -> l.beforeUndo(command));
		RuntimeException failure = runGuarded(command, history::undo);
		if (failure != null) {
			notifyListeners(l -> l.afterUndo(command, false));
			return handleFailure("Undo", command, failure);
		}
		notifyListeners(l -> l.afterUndo(command, true));
		return true;
	}

	/**
	 * Listeners see a redo as another execution of the same command.
	 *
	 * @return true if a command was redone; false if there was nothing to redo,
	 * or the redo failed and the {@link ErrorPolicy} is {@link ErrorPolicy#LOG LOG}.
	 * @throws IllegalStateException if a compound is open
	 */
	public boolean redo() {
		checkNotRunning("redo", null);
		checkNoCompound("redo");
		Command command = history.peekRedo().orElse(null);
		if (command == null) {
			return false;
		}
		notifyListeners(l -> l.beforeExecute(command));
		RuntimeException failure = runGuarded(command, history::redo);
		if (failure != null) {
			notifyListeners(l -> l.afterExecute(command, false));
			return handleFailure("Redo", command, failure);
		}
		notifyListeners(l -> l.afterExecute(command, true));
		return true;
	}

	public boolean canUndo() {
		return compoundDepth == 0 && history.canUndo();
	}

	public boolean canRedo() {
		return compoundDepth == 0 && history.canRedo();
	}

	public void clear() {
		checkNotRunning("clear", null);
		checkNoCompound("clear");
		history.clear();
	}

	public void beginInit() {
		checkNotRunning("beginInit", null);
		initDepth++;
		LOGGER.debug("beginInit depth {}", initDepth);
	}

	/**
	 * @throws IllegalStateException if there's no matching {@link #beginInit}
	 */
	public void endInit() {
		checkNotRunning("endInit", null);
		if (initDepth == 0) {
			throw new IllegalStateException("endInit without matching beginInit");
		}
		initDepth--;
		LOGGER.debug("endInit depth {}", initDepth);
	}

	/**
	 * @param name used for the resulting compound if this is the outermost call;
	 *             ignored otherwise.
	 */
	public void beginCompound(@NotNull String name) {
		requireNonNull(name);
		checkNotRunning("beginCompound", null);
		if (compoundDepth == 0) {
			pendingCompound = new CompoundCommand(name);
		}
		compoundDepth++;
		LOGGER.debug("beginCompound \"{}\" depth {}", name, compoundDepth);
	}

	/**
	 * The outermost call adds the accumulated compound to the history,
	 * unless nothing was executed since the matching {@link #beginCompound}.
	 *
	 * @throws IllegalStateException if there's no matching {@link #beginCompound}
	 */
	public void endCompound() {
		checkNotRunning("endCompound", null);
		if (compoundDepth == 0) {
			throw new IllegalStateException("endCompound without matching beginCompound");
		}
		compoundDepth--;
		LOGGER.debug("endCompound depth {}", compoundDepth);
		if (compoundDepth == 0) {
			CompoundCommand finished = pendingCompound;
			pendingCompound = null;
			if (finished.isEmpty()) {
				LOGGER.debug("Discarding empty compound \"{}\"", finished.name());
			} else {
				history.add(finished);
			}
		}
	}

	/**
	 * Undoes every command executed since the outermost {@link #beginCompound},
	 * newest first, and leaves compound mode entirely, regardless of nesting depth.
	 * Nothing is added to the history.
	 *
	 * @throws IllegalStateException if no compound is open
	 */
	public void abortCompound() {
		checkNotRunning("abortCompound", null);
		if (compoundDepth == 0) {
			throw new IllegalStateException("abortCompound without matching beginCompound");
		}
		CompoundCommand aborted = pendingCompound;
		pendingCompound = null;
		compoundDepth = 0;
		LOGGER.debug("Aborting compound \"{}\" with {} commands", aborted.name(), aborted.size());
		RuntimeException failure = runGuarded(aborted, aborted::undo);
		if (failure != null) {
			throw failure;
		}
	}

	public InitScope initScope() {
		return new InitScope();
	}

	public CompoundScope compoundScope(String name) {
		return new CompoundScope(name);
	}

	public void addListener(@NotNull CommandListener listener) {
		listeners.add(requireNonNull(listener));
	}

	public boolean removeListener(CommandListener listener) {
		return listeners.remove(listener);
	}

	public boolean isExecuting() {
		return running != null;
	}

	public boolean isInitializing() {
		return initDepth > 0;
	}

	public boolean isInCompound() {
		return compoundDepth > 0;
	}

	/**
	 * @return the command being executed, undone or redone right now, if any
	 */
	public @Nullable Command runningCommand() {
		return running;
	}

	private @Nullable RuntimeException runGuarded(Command command, Runnable action) {
		running = command;
		try {
			action.run();
			return null;
		} catch (RuntimeException e) {
			return e;
		} finally {
			running = null;
		}
	}

	private boolean handleFailure(String verb, Command command, RuntimeException failure) {
		if (settings.errorPolicy() == ErrorPolicy.LOG) {
			LOGGER.error("{} of \"{}\" failed", verb, command.name(), failure);
			return false;
		} else {
			throw failure;
		}
	}

	private void checkNotRunning(String operation, @Nullable Command attempted) {
		if (running != null) {
			String what = (attempted == null) ? operation : operation + " \"" + attempted.name() + "\"";
			throw new ReentrantExecutionException("Can't " + what + " while \"" + running.name() + "\" is running");
		}
	}

	private void checkNoCompound(String operation) {
		if (compoundDepth > 0) {
			throw new IllegalStateException("Can't " + operation + " while compound \"" + pendingCompound.name() + "\" is open");
		}
	}

	private void notifyListeners(Consumer<CommandListener> callback) {
		for (CommandListener listener: listeners) {
			try {
				callback.accept(listener);
			} catch (RuntimeException e) {
				LOGGER.warn("Command listener {} failed", listener, e);
			}
		}
	}

	/**
	 * Calls {@link #endInit} when closed.
	 */
	public final class InitScope implements AutoCloseable {
		private InitScope() {
			beginInit();
		}

		@Override
		public void close() {
			endInit();
		}
	}

	/**
	 * Calls {@link #endCompound} when closed, unless the compound was already
	 * aborted by {@link #abort}.
	 */
	public final class CompoundScope implements AutoCloseable {
		private boolean aborted = false;

		private CompoundScope(String name) {
			beginCompound(name);
		}

		public void abort() {
			aborted = true;
			abortCompound();
		}

		@Override
		public void close() {
			if (!aborted) {
				endCompound();
			}
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(CommandManager.class);
}
