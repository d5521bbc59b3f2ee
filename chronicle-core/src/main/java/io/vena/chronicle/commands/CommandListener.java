package io.vena.chronicle.commands;

/**
 * Receives callbacks around every command the {@link CommandManager} runs.
 * All methods default to doing nothing.
 *
 * <p>
 * Exceptions thrown by a listener are logged and otherwise ignored.
 */
public interface CommandListener {
	default void beforeExecute(Command command) { }

	default void afterExecute(Command command, boolean success) { }

	default void beforeUndo(Command command) { }

	default void afterUndo(Command command, boolean success) { }
}
