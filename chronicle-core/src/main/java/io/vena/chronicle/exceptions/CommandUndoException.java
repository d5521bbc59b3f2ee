package io.vena.chronicle.exceptions;

import io.vena.chronicle.commands.Command;
import io.vena.chronicle.commands.CommandHistory;

/**
 * Thrown by {@link Command#undo()} when the command doesn't have the state it
 * needs to restore what it changed.
 *
 * <p>
 * There is no automatic retry. A {@link CommandHistory} that sees one of these
 * considers itself unreliable from then on.
 */
public class CommandUndoException extends RuntimeException {
	public CommandUndoException(String message) { super(message); }
	public CommandUndoException(String message, Throwable cause) { super(message, cause); }
	public CommandUndoException(Throwable cause) { super(cause); }
}
