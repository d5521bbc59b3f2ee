package io.vena.chronicle.serialization;

import io.vena.chronicle.exceptions.DeserializationException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.experimental.Accessors;

/**
 * A {@link LocalDate} or {@link LocalDateTime} in ISO-8601 form.
 */
@Value
@Accessors(fluent = true)
public class TemporalNode implements SerializedNode {
	Kind kind;
	String iso;

	public static TemporalNode of(LocalDate date) {
		return new TemporalNode(Kind.DATE, date.toString());
	}

	public static TemporalNode of(LocalDateTime dateTime) {
		return new TemporalNode(Kind.DATETIME, dateTime.toString());
	}

	/**
	 * @throws DeserializationException if {@link #iso} isn't valid for {@link #kind}
	 */
	public Object toTemporal() {
		try {
			switch (kind) {
				case DATE:
					return LocalDate.parse(iso);
				case DATETIME:
					return LocalDateTime.parse(iso);
				default:
					throw new AssertionError("Unexpected kind: " + kind);
			}
		} catch (DateTimeParseException e) {
			throw new DeserializationException("Invalid " + kind.tag() + " \"" + iso + "\"", e);
		}
	}

	@Getter
	@Accessors(fluent = true)
	@RequiredArgsConstructor
	public enum Kind {
		DATE(DocumentFormat.DATE_TAG),
		DATETIME(DocumentFormat.DATETIME_TAG),
		;

		/**
		 * The value of {@link DocumentFormat#TYPE_TAG} in stored documents.
		 */
		private final String tag;
	}
}
