package io.vena.chronicle.commands;

import java.util.ArrayList;
import java.util.List;
import java.util.ListIterator;
import java.util.function.Consumer;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;

/**
 * An ordered group of commands that executes, undoes and redoes as a single unit.
 *
 * <p>
 * Children execute in the order they were added and undo in reverse order.
 * Execution is all-or-nothing: if a child throws, the children that already
 * ran are undone, newest first, and the child's exception is rethrown.
 * Any failures during that rollback are attached to it as suppressed exceptions.
 */
public class CompoundCommand extends AbstractCommand {
	private final List<Command> children = new ArrayList<>();

	public CompoundCommand(String name) {
		super(name);
	}

	public CompoundCommand add(@NotNull Command child) {
		children.add(requireNonNull(child));
		return this;
	}

	public List<Command> children() {
		return unmodifiableList(children);
	}

	public boolean isEmpty() {
		return children.isEmpty();
	}

	public int size() {
		return children.size();
	}

	@Override
	public void execute() {
		applyInOrder(Command::execute);
	}

	@Override
	public void redo() {
		applyInOrder(Command::redo);
	}

	/**
	 * Assumes the children were successfully executed.
	 */
	@Override
	public void undo() {
		for (ListIterator<Command> iter = children.listIterator(children.size()); iter.hasPrevious(); ) {
			iter.previous().undo();
		}
	}

	private void applyInOrder(Consumer<Command> action) {
		List<Command> completed = new ArrayList<>(children.size());
		for (Command child: children) {
			try {
				action.accept(child);
			} catch (RuntimeException e) {
				LOGGER.debug("Child \"{}\" of \"{}\" failed; rolling back {} completed children", child.name(), name(), completed.size());
				rollBack(completed, e);
				throw e;
			}
			completed.add(child);
		}
	}

	private static void rollBack(List<Command> completed, RuntimeException cause) {
		for (ListIterator<Command> iter = completed.listIterator(completed.size()); iter.hasPrevious(); ) {
			Command command = iter.previous();
			try {
				command.undo();
			} catch (RuntimeException undoFailure) {
				cause.addSuppressed(undoFailure);
			}
		}
	}

	@Override
	public String toString() {
		return name() + children;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(CompoundCommand.class);
}
