package org.javai.paradox.script.schema;

import java.util.Locale;
import org.javai.paradox.script.node.ContainerNode;
import org.javai.paradox.script.node.ListNode;
import org.javai.paradox.script.node.ParadoxDate;
import org.javai.paradox.script.node.RgbColor;
import org.javai.paradox.script.node.ScalarNode;
import org.javai.paradox.script.node.ScriptNode;

/**
 * The declared type of a schema key. Written in lower case in schema YAML.
 */
public enum ValueType {
	STRING,
	INT,
	FLOAT,
	BOOL,
	DATE,
	OBJECT,
	LIST,
	COLOR,
	ANY;

	public String yamlName() {
		return name().toLowerCase(Locale.ROOT);
	}

	public static ValueType fromYaml(String name) {
		return valueOf(name.trim().toUpperCase(Locale.ROOT));
	}

	public boolean matches(ScriptNode node) {
		return switch (this) {
			case ANY -> true;
			case OBJECT -> node instanceof ContainerNode;
			case LIST -> node instanceof ListNode;
			default -> node instanceof ScalarNode scalar && matchesValue(scalar.value());
		};
	}

	private boolean matchesValue(Object value) {
		return switch (this) {
			case STRING -> value instanceof String;
			// floats accept integral numbers, ints do not accept fractions
			case INT -> value instanceof Integer || value instanceof Long;
			case FLOAT -> value instanceof Number;
			case BOOL -> value instanceof Boolean;
			case DATE -> value instanceof ParadoxDate;
			case COLOR -> value instanceof RgbColor;
			default -> false;
		};
	}
}
