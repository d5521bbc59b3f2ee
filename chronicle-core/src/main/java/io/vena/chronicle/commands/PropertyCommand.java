package io.vena.chronicle.commands;

import io.vena.chronicle.Observable;
import io.vena.chronicle.ObservableProperty;
import io.vena.chronicle.exceptions.CommandExecutionException;
import io.vena.chronicle.exceptions.CommandUndoException;
import java.util.Objects;
import java.util.Optional;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Sets one property of one {@link Observable} to an absolute value.
 *
 * <p>
 * The old value is captured each time the command executes, so it reflects
 * whatever earlier commands did, and so does its undo.
 *
 * <p>
 * Two property commands on the same object and property merge into one
 * when the first one's new value is the second one's old value:
 * typing "a", "ab", "abc" into a field can become a single undo step.
 */
@Accessors(fluent = true)
public class PropertyCommand extends AbstractCommand {
	@Getter private final Observable target;
	@Getter private final String propertyName;
	@Getter private final @Nullable Object newValue;
	private @Nullable Object oldValue;
	private boolean executed = false;

	public PropertyCommand(@NotNull Observable target, @NotNull String propertyName, @Nullable Object newValue) {
		super("Set " + propertyName);
		this.target = requireNonNull(target);
		this.propertyName = requireNonNull(propertyName);
		this.newValue = newValue;
	}

	public <T> PropertyCommand(@NotNull Observable target, @NotNull ObservableProperty<T> property, @Nullable T newValue) {
		this(target, property.name(), newValue);
	}

	private PropertyCommand(PropertyCommand earlier, PropertyCommand later) {
		super(earlier.name());
		this.target = earlier.target;
		this.propertyName = earlier.propertyName;
		this.newValue = later.newValue;
		this.oldValue = earlier.oldValue;
		this.executed = true;
	}

	@Override
	public void execute() {
		if (!target.schema().hasProperty(propertyName)) {
			throw new CommandExecutionException(target.getClass().getSimpleName() + " has no property \"" + propertyName + "\"");
		}
		ObservableProperty<?> property = target.schema().property(propertyName);
		if (!property.accepts(newValue)) {
			throw new CommandExecutionException("Property \"" + propertyName + "\" of " + target
				+ " requires " + property.type().getSimpleName()
				+ ", not " + newValue.getClass().getSimpleName());
		}
		Object valueBefore = target.get(propertyName);
		target.set(propertyName, newValue);
		oldValue = valueBefore;
		executed = true;
	}

	@Override
	public void undo() {
		if (!executed) {
			throw new CommandUndoException("Can't undo \"" + name() + "\" on " + target + " because it was never executed");
		}
		target.set(propertyName, oldValue);
	}

	/**
	 * @return the value this command replaced the last time it executed
	 * @throws IllegalStateException if it hasn't executed
	 */
	public @Nullable Object oldValue() {
		if (!executed) {
			throw new IllegalStateException("\"" + name() + "\" has not executed");
		}
		return oldValue;
	}

	public boolean hasExecuted() {
		return executed;
	}

	@Override
	public Optional<Command> mergeWith(Command later) {
		if (!(later instanceof PropertyCommand)) {
			return Optional.empty();
		}
		PropertyCommand next = (PropertyCommand) later;
		if (next.target == this.target
			&& next.propertyName.equals(this.propertyName)
			&& this.executed && next.executed
			&& Objects.equals(this.newValue, next.oldValue)
		) {
			return Optional.of(new PropertyCommand(this, next));
		} else {
			return Optional.empty();
		}
	}

	@Override
	public String toString() {
		return name() + " on " + target + " to " + newValue;
	}
}
