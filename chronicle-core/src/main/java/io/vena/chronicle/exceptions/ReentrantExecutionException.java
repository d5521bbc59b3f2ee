package io.vena.chronicle.exceptions;

import io.vena.chronicle.commands.CommandManager;

/**
 * Thrown to code that calls back into a {@link CommandManager} while that
 * same manager is in the middle of executing, undoing or redoing a command.
 * The nested call is rejected and the history is left untouched.
 */
public class ReentrantExecutionException extends IllegalStateException {
	public ReentrantExecutionException(String message) { super(message); }
	public ReentrantExecutionException(String message, Throwable cause) { super(message, cause); }
	public ReentrantExecutionException(Throwable cause) { super(cause); }
}
