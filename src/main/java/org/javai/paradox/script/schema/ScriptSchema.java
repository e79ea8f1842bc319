package org.javai.paradox.script.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Describes the keys a kind of script file may contain.
 *
 * @param id               schema identifier, e.g. {@code province_history}
 * @param description      free text
 * @param allowUnknownKeys when {@code true}, unknown keys are only reported if they look like a
 *                         typo of a declared key
 * @param keys             key rules by name, in declaration order
 */
public record ScriptSchema(String id, String description, boolean allowUnknownKeys, Map<String, KeyRule> keys) {

	public ScriptSchema {
		if (id == null || id.isBlank()) {
			throw new IllegalArgumentException("Schema id cannot be blank");
		}
		keys = Collections.unmodifiableMap(new LinkedHashMap<>(keys));
	}

	public Optional<KeyRule> rule(String key) {
		return Optional.ofNullable(keys.get(key));
	}

	public boolean declares(String key) {
		return keys.containsKey(key);
	}

	public List<String> requiredKeys() {
		return keys.values().stream().filter(KeyRule::required).map(KeyRule::name).toList();
	}
}
