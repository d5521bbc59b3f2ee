package io.vena.chronicle.exceptions;

import io.vena.chronicle.Identifier;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * A document refers to an identifier for which it contains no object record.
 */
@Accessors(fluent = true)
public class DanglingReferenceException extends DeserializationException {
	@Getter private final Identifier missingId;

	public DanglingReferenceException(Identifier missingId, String message) {
		super(message);
		this.missingId = missingId;
	}
}
