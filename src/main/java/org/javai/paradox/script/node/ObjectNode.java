package org.javai.paradox.script.node;

/**
 * Block of keyed statements: {@code key = { ... }}. Also the type of every parse root.
 */
public final class ObjectNode extends ContainerNode {

	ObjectNode(String key) {
		super(key);
	}

	@Override
	public NodeKind kind() {
		return NodeKind.OBJECT;
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitObject(this);
	}
}
