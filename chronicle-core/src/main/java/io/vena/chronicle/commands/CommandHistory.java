package io.vena.chronicle.commands;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;

/**
 * The done and redo stacks of executed commands.
 *
 * <p>
 * Commands are added <em>after</em> they have executed; the history never
 * executes a command for the first time. Adding a command discards everything
 * on the redo stack.
 *
 * <p>
 * Not thread-safe and not reentrant: a command's undo or redo must not call
 * back into the same history. {@link CommandManager} guards this.
 */
@Accessors(fluent = true)
public class CommandHistory {
	@Getter private final HistorySettings settings;
	private final Deque<Entry> done = new ArrayDeque<>();
	private final Deque<Command> undone = new ArrayDeque<>();

	/**
	 * Set when an undo throws, which means the application state may no longer
	 * match what the done stack says.
	 */
	private boolean reliable = true;

	/**
	 * When true, the current top of the done stack must not absorb new commands.
	 */
	private boolean mergeBarrier = false;

	public CommandHistory() {
		this(HistorySettings.builder().build());
	}

	public CommandHistory(@NotNull HistorySettings settings) {
		this.settings = requireNonNull(settings);
	}

	public void add(@NotNull Command command) {
		requireNonNull(command);
		Instant now = settings.clock().instant();
		undone.clear();
		Optional<Command> merged = tryMerge(command, now);
		if (merged.isPresent()) {
			Entry top = done.removeLast();
			done.addLast(new Entry(merged.get(), top.firstRecorded));
			LOGGER.debug("Merged \"{}\" into \"{}\"", command.name(), top.command.name());
		} else {
			done.addLast(new Entry(command, now));
			mergeBarrier = false;
			if (settings.maxDepth() > 0) {
				while (done.size() > settings.maxDepth()) {
					Entry evicted = done.removeFirst();
					LOGGER.debug("Evicted \"{}\" beyond max depth {}", evicted.command.name(), settings.maxDepth());
				}
			}
		}
	}

	private Optional<Command> tryMerge(Command command, Instant now) {
		if (settings.compression() != HistorySettings.Compression.ADJACENT || mergeBarrier || done.isEmpty()) {
			return Optional.empty();
		}
		Entry top = done.peekLast();
		Duration age = Duration.between(top.firstRecorded, now);
		if (age.compareTo(settings.compressionWindow()) > 0) {
			return Optional.empty();
		}
		return top.command.mergeWith(command);
	}

	/**
	 * Undoes the most recent command and moves it to the redo stack.
	 *
	 * <p>
	 * If the command's undo throws, the command stays on the done stack,
	 * the history is marked unreliable, and the exception propagates.
	 *
	 * @return the command that was undone, or null if there was nothing to undo
	 */
	public @Nullable Command undo() {
		Entry entry = done.pollLast();
		if (entry == null) {
			return null;
		}
		mergeBarrier = true;
		try {
			entry.command.undo();
		} catch (RuntimeException e) {
			done.addLast(entry);
			reliable = false;
			LOGGER.error("Undo of \"{}\" failed; history is no longer reliable", entry.command.name(), e);
			throw e;
		}
		undone.addLast(entry.command);
		return entry.command;
	}

	/**
	 * Redoes the most recently undone command and moves it back to the done stack.
	 * If the command's redo throws, it stays on the redo stack and the exception propagates.
	 *
	 * @return the command that was redone, or null if there was nothing to redo
	 */
	public @Nullable Command redo() {
		Command command = undone.pollLast();
		if (command == null) {
			return null;
		}
		mergeBarrier = true;
		try {
			command.redo();
		} catch (RuntimeException e) {
			undone.addLast(command);
			LOGGER.debug("Redo of \"{}\" failed", command.name(), e);
			throw e;
		}
		done.addLast(new Entry(command, settings.clock().instant()));
		return command;
	}

	public boolean canUndo() {
		return !done.isEmpty();
	}

	public boolean canRedo() {
		return !undone.isEmpty();
	}

	/**
	 * @return the command {@link #undo} would undo, without undoing it
	 */
	public Optional<Command> peekUndo() {
		Entry top = done.peekLast();
		return (top == null) ? Optional.empty() : Optional.of(top.command);
	}

	public Optional<Command> peekRedo() {
		return Optional.ofNullable(undone.peekLast());
	}

	public void clear() {
		done.clear();
		undone.clear();
		mergeBarrier = true;
		reliable = true;
	}

	/**
	 * @return the done stack, oldest first
	 */
	public List<Command> executedCommands() {
		List<Command> result = new ArrayList<>(done.size());
		for (Entry entry: done) {
			result.add(entry.command);
		}
		return unmodifiableList(result);
	}

	/**
	 * @return the redo stack, oldest first; the last element is the next to be redone
	 */
	public List<Command> undoneCommands() {
		return unmodifiableList(new ArrayList<>(undone));
	}

	public int undoDepth() {
		return done.size();
	}

	public int redoDepth() {
		return undone.size();
	}

	/**
	 * @return false once any undo has failed, until {@link #clear}
	 */
	public boolean isReliable() {
		return reliable;
	}

	@RequiredArgsConstructor
	private static final class Entry {
		final Command command;
		final Instant firstRecorded;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(CommandHistory.class);
}
