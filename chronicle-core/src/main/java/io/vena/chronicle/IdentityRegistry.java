package io.vena.chronicle;

import java.lang.ref.Reference;
import java.lang.ref.ReferenceQueue;
import java.lang.ref.WeakReference;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Index from {@link Identifier} to live {@link Observable}.
 *
 * <p>
 * Entries are weak: the registry never keeps an object alive, and entries
 * for collected objects are expunged lazily. Unregistering an object only
 * removes it from the index.
 *
 * <p>
 * Not thread-safe. See {@link Chronicle} for a locked façade.
 */
public final class IdentityRegistry {
	private final Map<Identifier, Entry> entries = new HashMap<>();
	private final ReferenceQueue<Observable> collected = new ReferenceQueue<>();

	/**
	 * Assigns a fresh identifier if the object doesn't have one yet.
	 * Registering the same object again is a no-op.
	 *
	 * @return the object's identifier
	 * @throws IllegalStateException if a different live object is already registered under the same identifier
	 */
	public Identifier register(@NotNull Observable observable) {
		requireNonNull(observable);
		expungeStaleEntries();
		if (!observable.hasId()) {
			observable.assignId(Identifier.random());
		}
		Identifier id = observable.id();
		Entry existing = entries.get(id);
		if (existing != null) {
			Observable current = existing.get();
			if (current == observable) {
				return id;
			} else if (current != null) {
				throw new IllegalStateException("Identifier " + id + " already belongs to " + current);
			}
		}
		entries.put(id, new Entry(id, observable, collected));
		LOGGER.trace("Registered {}", observable);
		return id;
	}

	/**
	 * Like {@link #register}, except that any other object registered under the
	 * same identifier is displaced. Used when a freshly loaded object supersedes
	 * an older copy of the same logical object.
	 *
	 * @throws IllegalArgumentException if the object has no identifier
	 */
	public void rebind(@NotNull Observable observable) {
		if (!observable.hasId()) {
			throw new IllegalArgumentException("Can't rebind " + observable.getClass().getSimpleName() + " with no identifier");
		}
		expungeStaleEntries();
		Identifier id = observable.id();
		Entry displaced = entries.put(id, new Entry(id, observable, collected));
		Observable previous = (displaced == null) ? null : displaced.get();
		if (previous != null && previous != observable) {
			LOGGER.debug("Rebound {}; displaced an older instance", id);
		}
	}

	public Optional<Observable> resolve(Identifier id) {
		expungeStaleEntries();
		Entry entry = entries.get(id);
		return (entry == null) ? Optional.empty() : Optional.ofNullable(entry.get());
	}

	/**
	 * @throws ClassCastException if the object isn't a <code>type</code>
	 */
	public <T extends Observable> Optional<T> resolve(Identifier id, Class<T> type) {
		return resolve(id).map(type::cast);
	}

	public boolean contains(Identifier id) {
		return resolve(id).isPresent();
	}

	/**
	 * @return true if there was an entry to remove
	 */
	public boolean unregister(Identifier id) {
		expungeStaleEntries();
		Entry removed = entries.remove(id);
		return removed != null && removed.get() != null;
	}

	public int size() {
		expungeStaleEntries();
		return entries.size();
	}

	private void expungeStaleEntries() {
		for (Reference<? extends Observable> ref = collected.poll(); ref != null; ref = collected.poll()) {
			Entry stale = (Entry) ref;
			// Only remove the mapping if it still points at the collected entry
			entries.remove(stale.id, stale);
		}
	}

	private static final class Entry extends WeakReference<Observable> {
		final Identifier id;

		Entry(Identifier id, Observable referent, ReferenceQueue<Observable> queue) {
			super(referent, queue);
			this.id = id;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(IdentityRegistry.class);
}
