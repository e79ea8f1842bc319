package org.javai.paradox.script.node;

import java.util.List;

/**
 * Utility class for walking script trees with visitors.
 */
public final class NodeWalker {

	private NodeWalker() {
		// Utility class - no instantiation
	}

	/**
	 * Visits the node before its children.
	 *
	 * @return the result of visiting {@code node}
	 */
	public static <R> R walkPreOrder(ScriptNode node, NodeVisitor<R> visitor) {
		if (node == null) {
			return null;
		}

		R result = node.accept(visitor);
		for (ScriptNode child : childrenOf(node)) {
			walkPreOrder(child, visitor);
		}
		return result;
	}

	/**
	 * Visits the children before the node.
	 *
	 * @return the result of visiting {@code node}
	 */
	public static <R> R walkPostOrder(ScriptNode node, NodeVisitor<R> visitor) {
		if (node == null) {
			return null;
		}

		for (ScriptNode child : childrenOf(node)) {
			walkPostOrder(child, visitor);
		}
		return node.accept(visitor);
	}

	private static Iterable<ScriptNode> childrenOf(ScriptNode node) {
		if (node instanceof ContainerNode container) {
			return container.children().values();
		}
		if (node instanceof ListNode list) {
			return list.items();
		}
		return List.of();
	}
}
