package org.javai.paradox.script.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered sequence of nodes. Produced for value lists ({@code add_core = { FRA ENG }}) and when
 * repeated keys are accumulated.
 */
public final class ListNode implements ScriptNode {

	private final String key;
	private final List<ScriptNode> items = new ArrayList<>();

	ListNode(String key) {
		this.key = key != null ? key : "";
	}

	@Override
	public String key() {
		return key;
	}

	@Override
	public NodeKind kind() {
		return NodeKind.LIST;
	}

	@Override
	public void addItem(ScriptNode item) {
		items.add(Objects.requireNonNull(item, "item must not be null"));
	}

	public List<ScriptNode> items() {
		return Collections.unmodifiableList(items);
	}

	public int size() {
		return items.size();
	}

	public boolean isEmpty() {
		return items.isEmpty();
	}

	/**
	 * Coerces every item to {@code type}, skipping items that do not convert.
	 */
	public <T> List<T> values(Class<T> type) {
		List<T> values = new ArrayList<>();
		for (ScriptNode item : items) {
			ValueCoercion.coerce(item, type).ifPresent(values::add);
		}
		return values;
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitList(this);
	}

	@Override
	public String toString() {
		return NodePrinter.print(this);
	}
}
