package org.javai.paradox.script.node;

import java.util.Objects;

/**
 * Historical block keyed by a date: {@code 1444.11.11 = { owner = FRA }}.
 * Holds children like an {@link ObjectNode} and carries the parsed date.
 */
public final class DateNode extends ContainerNode {

	private final ParadoxDate date;

	DateNode(String key, ParadoxDate date) {
		super(key);
		this.date = Objects.requireNonNull(date, "date must not be null");
	}

	public ParadoxDate date() {
		return date;
	}

	@Override
	public NodeKind kind() {
		return NodeKind.DATE;
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitDate(this);
	}
}
