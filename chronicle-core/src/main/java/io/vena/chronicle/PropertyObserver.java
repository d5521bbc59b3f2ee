package io.vena.chronicle;

/**
 * Called after a property of an {@link Observable} has changed value.
 */
public interface PropertyObserver {
	/**
	 * Exceptions thrown from here are logged and otherwise ignored,
	 * so they can't prevent other observers from running.
	 */
	void onChanged(PropertyChange change);
}
