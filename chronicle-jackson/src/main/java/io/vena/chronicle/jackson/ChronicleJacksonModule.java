package io.vena.chronicle.jackson;

import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.Module;

/**
 * The Jackson face of {@link JacksonPlugin}. Every instance has the same
 * module name, so registering a second one with the same mapper is a no-op.
 */
public abstract class ChronicleJacksonModule extends Module {
	public static final String MODULE_NAME = "chronicle";

	@Override
	public String getModuleName() {
		return MODULE_NAME;
	}

	@Override
	public Object getTypeId() {
		return MODULE_NAME;
	}

	@Override
	public Version version() {
		return Version.unknownVersion();
	}
}
