package org.javai.paradox.script.schema;

/**
 * Declaration of one allowed key.
 *
 * @param name        the key
 * @param type        expected value type
 * @param required    whether the key must appear at the top level
 * @param description free text for humans, may be {@code null}
 */
public record KeyRule(String name, ValueType type, boolean required, String description) {

	public KeyRule {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("Key name cannot be blank");
		}
		if (type == null) {
			type = ValueType.ANY;
		}
	}
}
