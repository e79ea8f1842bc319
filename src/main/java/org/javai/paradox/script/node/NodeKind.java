package org.javai.paradox.script.node;

/**
 * Discriminator for the {@link ScriptNode} variants, handy for {@code switch} statements.
 */
public enum NodeKind {
	SCALAR,
	LIST,
	OBJECT,
	DATE
}
