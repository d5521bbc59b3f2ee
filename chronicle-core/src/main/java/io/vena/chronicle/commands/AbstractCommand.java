package io.vena.chronicle.commands;

import java.util.LinkedHashMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

import static java.util.Collections.unmodifiableMap;

/**
 * Supplies a display name and a place for callers to attach context,
 * such as which part of the user interface triggered the command.
 */
public abstract class AbstractCommand implements Command {
	private final String name;
	private final Map<String, Object> contextInfo = new LinkedHashMap<>();

	protected AbstractCommand(String name) {
		this.name = name;
	}

	protected AbstractCommand() {
		this.name = getClass().getSimpleName();
	}

	@Override
	public String name() {
		return name;
	}

	public void putContextInfo(String key, @Nullable Object value) {
		contextInfo.put(key, value);
	}

	public @Nullable Object contextInfo(String key) {
		return contextInfo.get(key);
	}

	public Map<String, Object> contextInfo() {
		return unmodifiableMap(contextInfo);
	}

	@Override
	public String toString() {
		return name;
	}
}
