package io.vena.chronicle.exceptions;

import io.vena.chronicle.commands.Command;

/**
 * Thrown by {@link Command#execute()} when a precondition fails.
 * The command must not have changed anything, so it's safe to discard.
 */
public class CommandExecutionException extends RuntimeException {
	public CommandExecutionException(String message) { super(message); }
	public CommandExecutionException(String message, Throwable cause) { super(message, cause); }
	public CommandExecutionException(Throwable cause) { super(cause); }
}
