package io.vena.chronicle.commands;

import lombok.Builder;
import lombok.Value;
import lombok.experimental.Accessors;

@Value
@Accessors(fluent = true)
@Builder
public class CommandManagerSettings {
	@Builder.Default
	HistorySettings history = HistorySettings.builder().build();

	@Builder.Default
	ErrorPolicy errorPolicy = ErrorPolicy.PROPAGATE;

	/**
	 * What {@link CommandManager#execute} does when a command throws.
	 */
	public enum ErrorPolicy {
		/**
		 * Rethrow to the caller.
		 */
		PROPAGATE,

		/**
		 * Log it and return false.
		 */
		LOG,
	}
}
