package org.javai.paradox.script.node;

/**
 * Visitor over the {@link ScriptNode} variants.
 *
 * @param <R> the return type of the visitor operations
 */
public interface NodeVisitor<R> {

	R visitScalar(ScalarNode node);

	R visitList(ListNode node);

	R visitObject(ObjectNode node);

	R visitDate(DateNode node);
}
