package io.vena.chronicle;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Collections.emptySet;
import static java.util.Collections.unmodifiableSet;
import static java.util.Objects.requireNonNull;

/**
 * Base class for domain objects whose named properties emit change notifications.
 *
 * <p>
 * Each concrete subclass passes its {@link ObservableSchema} to the constructor;
 * the schema fixes the set of property names for every instance of the type.
 * Subclasses usually add typed accessors on top of {@link #get(ObservableProperty)}
 * and {@link #set(ObservableProperty, Object)}.
 *
 * <p>
 * A write that doesn't change a property's value (according to {@link Objects#equals})
 * is ignored. A write that does change it notifies that property's observers, in the order
 * they were added, iterating over a snapshot so observers may add or remove observers freely.
 * Observer exceptions are logged and don't prevent the remaining observers from running.
 *
 * <p>
 * If an observer writes a new value to the very property whose notification is in progress
 * on this same object, the value is stored but no nested notification is started for it.
 * This is what stops two bindings that mirror each other from ping-ponging forever.
 * Writes to <em>other</em> properties from inside an observer notify as usual.
 *
 * <p>
 * Not thread-safe. See {@link Chronicle} for a locked façade.
 */
public abstract class Observable {
	private final ObservableSchema schema;
	private final Map<String, Object> values = new HashMap<>();
	private final Map<String, LinkedHashMap<Identifier, PropertyObserver>> observers = new HashMap<>();
	private NotificationState notificationState = NotificationState.IDLE;
	private @Nullable Identifier id;

	protected Observable(@NotNull ObservableSchema schema) {
		this.schema = requireNonNull(schema);
		if (!schema.ownerType().isInstance(this)) {
			throw new IllegalArgumentException("Schema for " + schema.ownerType().getSimpleName() + " can't be used by " + getClass().getSimpleName());
		}
	}

	protected Observable(@NotNull ObservableSchema schema, @NotNull Identifier id) {
		this(schema);
		this.id = requireNonNull(id);
	}

	public final ObservableSchema schema() {
		return schema;
	}

	/**
	 * @throws IllegalStateException if no identifier has been assigned yet.
	 * @see IdentityRegistry#register
	 */
	public final Identifier id() {
		if (id == null) {
			throw new IllegalStateException(getClass().getSimpleName() + " has no identifier yet");
		}
		return id;
	}

	public final boolean hasId() {
		return id != null;
	}

	/**
	 * Gives this object its permanent identifier.
	 * Assigning the identifier it already has is a no-op.
	 *
	 * @throws IllegalStateException if a different identifier was already assigned
	 */
	public final void assignId(@NotNull Identifier newId) {
		requireNonNull(newId);
		if (id == null) {
			id = newId;
		} else if (!id.equals(newId)) {
			throw new IllegalStateException("Can't change identifier of " + getClass().getSimpleName() + " from " + id + " to " + newId);
		}
	}

	/**
	 * @return the current value, or the property's declared default if it was never set
	 */
	public final @Nullable Object get(String propertyName) {
		ObservableProperty<?> property = schema.property(propertyName);
		if (values.containsKey(propertyName)) {
			return values.get(propertyName);
		} else {
			return property.defaultValue();
		}
	}

	public final <T> @Nullable T get(ObservableProperty<T> property) {
		ObservableProperty<T> declared = schema.property(property);
		return declared.type().cast(get(declared.name()));
	}

	/**
	 * @throws IllegalArgumentException if there's no such property, or
	 * <code>newValue</code> has the wrong type
	 */
	public final void set(String propertyName, @Nullable Object newValue) {
		ObservableProperty<?> property = schema.property(propertyName);
		if (!property.accepts(newValue)) {
			throw new IllegalArgumentException("Property " + describe(propertyName)
				+ " requires " + property.type().getSimpleName()
				+ ", not " + newValue.getClass().getSimpleName());
		}
		Object oldValue = get(propertyName);
		if (Objects.equals(oldValue, newValue)) {
			return;
		}
		values.put(propertyName, newValue);
		if (notificationState.isNotifying(propertyName)) {
			LOGGER.debug("Suppressing nested notification for {}: {} -> {}", describe(propertyName), oldValue, newValue);
			return;
		}
		notificationState = notificationState.entering(propertyName);
		try {
			notifyObservers(new PropertyChange(this, propertyName, oldValue, newValue));
		} finally {
			notificationState = notificationState.leaving(propertyName);
		}
	}

	public final <T> void set(ObservableProperty<T> property, @Nullable T newValue) {
		set(schema.property(property).name(), newValue);
	}

	/**
	 * @return a subscription identifier for {@link #removeObserver}
	 * @throws IllegalArgumentException if there's no such property
	 */
	public final Identifier addObserver(String propertyName, @NotNull PropertyObserver observer) {
		schema.property(propertyName);
		requireNonNull(observer);
		Identifier subscription = Identifier.unique("subscription-");
		observers.computeIfAbsent(propertyName, __ -> new LinkedHashMap<>()).put(subscription, observer);
		return subscription;
	}

	public final Identifier addObserver(ObservableProperty<?> property, @NotNull PropertyObserver observer) {
		return addObserver(schema.property(property).name(), observer);
	}

	/**
	 * Idempotent: removing a subscription that is already gone does nothing.
	 *
	 * @return true if the subscription was found and removed
	 */
	public final boolean removeObserver(String propertyName, Identifier subscription) {
		LinkedHashMap<Identifier, PropertyObserver> forProperty = observers.get(propertyName);
		if (forProperty == null) {
			return false;
		}
		boolean removed = forProperty.remove(subscription) != null;
		if (forProperty.isEmpty()) {
			observers.remove(propertyName);
		}
		return removed;
	}

	public final int observerCount(String propertyName) {
		LinkedHashMap<Identifier, PropertyObserver> forProperty = observers.get(propertyName);
		return (forProperty == null) ? 0 : forProperty.size();
	}

	/**
	 * @return true while observers of <code>propertyName</code> on this object are being notified
	 */
	public final boolean isNotifying(String propertyName) {
		return notificationState.isNotifying(propertyName);
	}

	private void notifyObservers(PropertyChange change) {
		LinkedHashMap<Identifier, PropertyObserver> forProperty = observers.get(change.propertyName());
		if (forProperty == null) {
			return;
		}
		List<Map.Entry<Identifier, PropertyObserver>> snapshot = new ArrayList<>(forProperty.entrySet());
		for (Map.Entry<Identifier, PropertyObserver> entry: snapshot) {
			try {
				entry.getValue().onChanged(change);
			} catch (RuntimeException e) {
				LOGGER.warn("Observer {} failed on change {}", entry.getKey(), change, e);
			}
		}
	}

	private String describe(String propertyName) {
		return getClass().getSimpleName() + "(" + id + ")." + propertyName;
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "(" + id + ")";
	}

	/**
	 * Which properties of this object are currently notifying their observers.
	 * Immutable; each transition produces a new state.
	 */
	private static final class NotificationState {
		static final NotificationState IDLE = new NotificationState(emptySet());

		final Set<String> notifying;

		private NotificationState(Set<String> notifying) {
			this.notifying = notifying;
		}

		boolean isNotifying(String propertyName) {
			return notifying.contains(propertyName);
		}

		NotificationState entering(String propertyName) {
			Set<String> result = new HashSet<>(notifying);
			result.add(propertyName);
			return new NotificationState(unmodifiableSet(result));
		}

		NotificationState leaving(String propertyName) {
			if (notifying.size() == 1 && notifying.contains(propertyName)) {
				return IDLE;
			}
			Set<String> result = new HashSet<>(notifying);
			result.remove(propertyName);
			return new NotificationState(unmodifiableSet(result));
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Observable.class);
}
