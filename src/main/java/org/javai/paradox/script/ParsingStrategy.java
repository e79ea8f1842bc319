package org.javai.paradox.script;

import java.util.List;
import org.javai.paradox.script.node.ObjectNode;

/**
 * Strategy interface for turning a token sequence into a tree.
 * <p>
 * {@link ScriptParser} owns tokenization, the log and the metrics; a strategy only decides how the
 * tree is built and what gets reported. {@link GenericParsingStrategy} accepts any well-formed script,
 * other strategies can restrict or validate what they build.
 */
public interface ParsingStrategy {

	/**
	 * Builds the tree for {@code tokens}.
	 *
	 * @param tokens the tokens to parse, terminated by an EOF token
	 * @param log    receives errors and warnings
	 * @return the root object, never {@code null}
	 * @throws ScriptParseException only for conditions the strategy cannot recover from
	 */
	ObjectNode parse(List<ScriptToken> tokens, ParseLog log) throws ScriptParseException;
}
