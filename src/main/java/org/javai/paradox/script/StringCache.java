package org.javai.paradox.script;

/**
 * Canonicalizes key and identifier strings produced while building trees.
 * <p>
 * Parsing results do not depend on the cache; it only lets large batches of files share repeated
 * keys such as {@code owner} or {@code add_core}. {@link #NONE} returns its argument unchanged.
 */
@FunctionalInterface
public interface StringCache {

	StringCache NONE = value -> value;

	String intern(String value);
}
