package io.vena.chronicle.commands;

import java.time.Clock;
import java.time.Duration;
import lombok.Builder;
import lombok.Value;
import lombok.experimental.Accessors;

@Value
@Accessors(fluent = true)
@Builder
public class HistorySettings {
	@Builder.Default
	Compression compression = Compression.DISABLED;

	/**
	 * How long after an entry is first recorded it can still absorb later commands.
	 */
	@Builder.Default
	Duration compressionWindow = Duration.ofSeconds(1);

	/**
	 * Zero means unbounded.
	 */
	@Builder.Default
	int maxDepth = 0;

	@Builder.Default
	Clock clock = Clock.systemUTC();

	public enum Compression {
		DISABLED,

		/**
		 * Merge each new command into the most recent entry when
		 * {@link Command#mergeWith} allows it.
		 */
		ADJACENT,
	}
}
