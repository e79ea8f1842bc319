package org.javai.paradox.script.node;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Shared behaviour of the keyed variants, {@link ObjectNode} and {@link DateNode}.
 * Children keep their insertion order so traversal and printing are reproducible.
 */
public abstract sealed class ContainerNode implements ScriptNode permits ObjectNode, DateNode {

	private final String key;
	private final Map<String, ScriptNode> children = new LinkedHashMap<>();

	ContainerNode(String key) {
		this.key = key != null ? key : "";
	}

	@Override
	public String key() {
		return key;
	}

	@Override
	public void addChild(ScriptNode child) {
		Objects.requireNonNull(child, "child must not be null");
		children.put(child.key(), child);
	}

	@Override
	public void addChildAccumulating(ScriptNode child) {
		Objects.requireNonNull(child, "child must not be null");
		ScriptNode existing = children.get(child.key());
		if (existing == null) {
			children.put(child.key(), child);
		} else if (existing instanceof ListNode list) {
			list.addItem(child);
		} else {
			ListNode list = ScriptNode.list(child.key());
			list.addItem(existing);
			list.addItem(child);
			children.put(child.key(), list);
		}
	}

	@Override
	public Optional<ScriptNode> getChild(String key) {
		return Optional.ofNullable(children.get(key));
	}

	@Override
	public List<ScriptNode> getChildren(String key) {
		ScriptNode child = children.get(key);
		if (child == null) {
			return List.of();
		}
		if (child instanceof ListNode list) {
			return list.items();
		}
		return List.of(child);
	}

	@Override
	public boolean hasChild(String key) {
		return children.containsKey(key);
	}

	/**
	 * Read-only view of the children in insertion order.
	 */
	public Map<String, ScriptNode> children() {
		return Collections.unmodifiableMap(children);
	}

	public int size() {
		return children.size();
	}

	public boolean isEmpty() {
		return children.isEmpty();
	}

	@Override
	public String toString() {
		return NodePrinter.print(this);
	}
}
