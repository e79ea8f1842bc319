package org.javai.paradox.script.node;

import java.util.Objects;

/**
 * Leaf node holding a single value.
 *
 * @param key   the statement key, empty for list items
 * @param value a {@link String}, {@link Integer}, {@link Long}, {@link Double}, {@link Boolean},
 *              {@link ParadoxDate} or {@link RgbColor}
 */
public record ScalarNode(String key, Object value) implements ScriptNode {

	public ScalarNode {
		key = key != null ? key : "";
		Objects.requireNonNull(value, "value must not be null");
		if (!isSupported(value)) {
			throw new IllegalArgumentException("Unsupported scalar value type: " + value.getClass().getName());
		}
	}

	private static boolean isSupported(Object value) {
		return value instanceof String
				|| value instanceof Integer
				|| value instanceof Long
				|| value instanceof Double
				|| value instanceof Boolean
				|| value instanceof ParadoxDate
				|| value instanceof RgbColor;
	}

	@Override
	public NodeKind kind() {
		return NodeKind.SCALAR;
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitScalar(this);
	}

	public boolean isText() {
		return value instanceof String;
	}

	public boolean isNumber() {
		return value instanceof Number;
	}

	public boolean isBoolean() {
		return value instanceof Boolean;
	}

	public boolean isDate() {
		return value instanceof ParadoxDate;
	}

	public boolean isColor() {
		return value instanceof RgbColor;
	}

	/**
	 * Coerces this node's own value; see {@link ScriptNode#getValue(String, Class, Object)}.
	 */
	public <T> T as(Class<T> type, T defaultValue) {
		return ValueCoercion.coerce(this, type).orElse(defaultValue);
	}

	@Override
	public String toString() {
		return NodePrinter.print(this);
	}
}
