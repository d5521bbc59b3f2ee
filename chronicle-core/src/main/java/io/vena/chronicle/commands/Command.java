package io.vena.chronicle.commands;

import io.vena.chronicle.exceptions.CommandExecutionException;
import io.vena.chronicle.exceptions.CommandUndoException;
import java.util.Optional;

/**
 * One reversible unit of work.
 *
 * <p>
 * Implementations must check their preconditions before changing anything,
 * so that a {@link CommandExecutionException} leaves the world untouched.
 * They should also apply absolute values rather than deltas, so that running
 * {@link #execute()} again after {@link #undo()} has the same effect as the
 * first time; the default {@link #redo()} relies on this.
 *
 * @see CommandManager
 */
public interface Command {
	/**
	 * @throws CommandExecutionException if a precondition fails. Nothing has been changed.
	 */
	void execute();

	/**
	 * Restores whatever {@link #execute()} changed.
	 *
	 * @throws CommandUndoException if the command lacks the state needed to do so
	 */
	void undo();

	default void redo() {
		execute();
	}

	/**
	 * Suitable for display, as in "Undo <em>name</em>".
	 */
	default String name() {
		return getClass().getSimpleName();
	}

	/**
	 * Offers to combine this already-executed command with a <code>later</code> one
	 * that was executed immediately after it.
	 * The result must undo to this command's starting state and
	 * redo to the later command's end state.
	 *
	 * @return the combined command, or empty if the two can't be merged
	 */
	default Optional<Command> mergeWith(Command later) {
		return Optional.empty();
	}
}
