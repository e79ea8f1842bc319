package org.javai.paradox.script.node;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A node of the parsed script tree.
 * <p>
 * The tree is a closed set of variants:
 * <ul>
 *   <li>{@link ScalarNode} - a single value (text, integer, float, boolean, date or color)</li>
 *   <li>{@link ObjectNode} - keyed children, last write wins, insertion order preserved</li>
 *   <li>{@link ListNode} - ordered items, used for value lists and for repeated keys</li>
 *   <li>{@link DateNode} - a historical block keyed by a date; behaves like an object</li>
 * </ul>
 * Nodes are built by the parser through the static factories below. The mutators
 * ({@link #addChild}, {@link #addChildAccumulating}, {@link #addItem}) are only meant for
 * construction and throw {@link IllegalStateException} on variants that do not support them.
 * <p>
 * The query methods ({@link #getChild}, {@link #getChildren}, {@link #hasChild}, {@link #getValue})
 * are the whole surface handed to consumers. On scalars and lists they simply find nothing.
 */
public sealed interface ScriptNode permits ScalarNode, ListNode, ContainerNode {

	/**
	 * Key used for the synthetic root of every parse.
	 */
	String ROOT_KEY = "root";

	/**
	 * The statement key this node was assigned under; empty for unlabeled list items.
	 */
	String key();

	NodeKind kind();

	<R> R accept(NodeVisitor<R> visitor);

	static ScalarNode scalar(String key, Object value) {
		return new ScalarNode(key, value);
	}

	static ObjectNode object(String key) {
		return new ObjectNode(key);
	}

	static ListNode list(String key) {
		return new ListNode(key);
	}

	static DateNode date(String key, ParadoxDate date) {
		return new DateNode(key, date);
	}

	static ObjectNode root() {
		return new ObjectNode(ROOT_KEY);
	}

	/**
	 * Adds or replaces the child stored under {@code child.key()}.
	 *
	 * @throws IllegalStateException unless this is an object or date node
	 */
	default void addChild(ScriptNode child) {
		throw new IllegalStateException("Cannot add child to " + kind() + " node '" + key() + "'");
	}

	/**
	 * Adds a child, turning repeated keys into a {@link ListNode} of all values seen.
	 *
	 * @throws IllegalStateException unless this is an object or date node
	 */
	default void addChildAccumulating(ScriptNode child) {
		throw new IllegalStateException("Cannot add child to " + kind() + " node '" + key() + "'");
	}

	/**
	 * Appends an item.
	 *
	 * @throws IllegalStateException unless this is a list node
	 */
	default void addItem(ScriptNode item) {
		throw new IllegalStateException("Cannot add item to " + kind() + " node '" + key() + "'");
	}

	default Optional<ScriptNode> getChild(String key) {
		return Optional.empty();
	}

	/**
	 * Returns every node stored under {@code key}: the items when the child is a list, the child
	 * itself otherwise, or an empty list when absent.
	 */
	default List<ScriptNode> getChildren(String key) {
		return List.of();
	}

	default boolean hasChild(String key) {
		return false;
	}

	/**
	 * Looks up the child stored under {@code key} and coerces its value to {@code type}.
	 * Never throws for missing keys or failed conversions; the default is returned instead.
	 */
	default <T> T getValue(String key, Class<T> type, T defaultValue) {
		Objects.requireNonNull(type, "type must not be null");
		return getChild(key)
				.flatMap(child -> ValueCoercion.coerce(child, type))
				.orElse(defaultValue);
	}

	default <T> Optional<T> findValue(String key, Class<T> type) {
		Objects.requireNonNull(type, "type must not be null");
		return getChild(key).flatMap(child -> ValueCoercion.coerce(child, type));
	}

	/**
	 * Coerces every node returned by {@link #getChildren(String)}, dropping the ones that do not convert.
	 */
	default <T> List<T> getValues(String key, Class<T> type) {
		Objects.requireNonNull(type, "type must not be null");
		List<T> values = new ArrayList<>();
		for (ScriptNode node : getChildren(key)) {
			ValueCoercion.coerce(node, type).ifPresent(values::add);
		}
		return values;
	}

	default String getString(String key) {
		return getValue(key, String.class, null);
	}

	default String getString(String key, String defaultValue) {
		return getValue(key, String.class, defaultValue);
	}

	default int getInt(String key, int defaultValue) {
		return getValue(key, Integer.class, defaultValue);
	}

	default long getLong(String key, long defaultValue) {
		return getValue(key, Long.class, defaultValue);
	}

	default double getDouble(String key, double defaultValue) {
		return getValue(key, Double.class, defaultValue);
	}

	default boolean getBoolean(String key, boolean defaultValue) {
		return getValue(key, Boolean.class, defaultValue);
	}

	default Optional<ParadoxDate> getDate(String key) {
		return findValue(key, ParadoxDate.class);
	}
}
