package org.javai.paradox.script;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.javai.paradox.script.ParserOptions.RepeatedKeyPolicy;
import org.javai.paradox.script.ScriptToken.TokenType;
import org.javai.paradox.script.node.ContainerNode;
import org.javai.paradox.script.node.ListNode;
import org.javai.paradox.script.node.ObjectNode;
import org.javai.paradox.script.node.ParadoxDate;
import org.javai.paradox.script.node.RgbColor;
import org.javai.paradox.script.node.ScriptNode;

/**
 * Recursive-descent parser for the generic script grammar:
 *
 * <pre>
 * file      := statement* EOF
 * statement := (DATE | IDENT) '=' ( '{' body '}' | value )
 * body      := statement* | item*
 * item      := value | '{' body '}'
 * value     := STRING | NUMBER | DATE | YES | NO | IDENT | COLOR
 * </pre>
 *
 * A block whose first entry is a value or an anonymous block is read as a list, unless one of its
 * top-level entries is keyed (an identifier or date followed by an operator).
 * <p>
 * Malformed statements never abort the parse. A key without {@code =}, or an {@code =} without a
 * value, is logged as an error and the parser skips ahead to the next identifier or date token,
 * jumping over balanced {@code {...}} groups, and stopping at the brace that closes the enclosing
 * block. Blocks nested deeper than {@link ParserOptions#maxNestingDepth()} are logged as errors
 * and skipped.
 */
public class GenericParsingStrategy implements ParsingStrategy {

	private static final Pattern DECIMAL = Pattern.compile("-?(\\d+\\.?\\d*|\\.\\d+)");

	private final RepeatedKeyPolicy repeatedKeys;
	private final StringCache stringCache;
	private final int maxNestingDepth;

	public GenericParsingStrategy() {
		this(ParserOptions.defaults());
	}

	public GenericParsingStrategy(ParserOptions options) {
		this.repeatedKeys = options.repeatedKeys();
		this.stringCache = options.stringCache();
		this.maxNestingDepth = options.maxNestingDepth();
	}

	@Override
	public ObjectNode parse(List<ScriptToken> tokens, ParseLog log) {
		ParserState state = new ParserState(tokens, log);
		ObjectNode root = ScriptNode.root();

		while (true) {
			state.skipComments();
			if (state.isAtEnd()) {
				break;
			}
			ScriptNode node = parseStatement(state, false);
			if (node != null) {
				add(root, node);
			}
		}

		return root;
	}

	/**
	 * Parses one statement; returns {@code null} when it was malformed and skipped.
	 *
	 * @param insideBlock whether a '}' closes an enclosing block
	 */
	protected ScriptNode parseStatement(ParserState state, boolean insideBlock) {
		ScriptToken token = state.peek();
		if (token.isType(TokenType.IDENTIFIER) || token.isType(TokenType.DATE)) {
			return parseAssignment(state, insideBlock);
		}

		state.log().warning("Unexpected " + describe(token) + " where a statement was expected", token);
		if (token.isType(TokenType.LEFT_BRACE)) {
			skipBalancedBraces(state);
		} else {
			state.advance();
		}
		skipToNextStatement(state, insideBlock);
		return null;
	}

	private ScriptNode parseAssignment(ParserState state, boolean insideBlock) {
		ScriptToken keyToken = state.advance();
		String key = stringCache.intern(keyToken.value());

		if (!state.check(TokenType.EQUALS)) {
			ScriptToken found = state.peek();
			state.log().error("Expected '=' after '" + key + "' but found " + describe(found), found);
			skipToNextStatement(state, insideBlock);
			return null;
		}
		state.advance(); // consume '='
		state.skipComments();

		ScriptToken valueToken = state.peek();
		if (valueToken.isType(TokenType.LEFT_BRACE)) {
			if (skipIfTooDeep(state, key, valueToken)) {
				return null;
			}
			state.advance(); // consume '{'
			return parseBlock(state, keyToken, key, valueToken);
		}
		if (!valueToken.isValue()) {
			state.log().error("Expected a value or '{' after '" + key + " =' but found " + describe(valueToken), valueToken);
			skipToNextStatement(state, insideBlock);
			return null;
		}

		state.advance();
		try {
			return ScriptNode.scalar(key, toValue(valueToken));
		} catch (ScriptParseException e) {
			state.log().error(e.getMessage(), valueToken);
			return null;
		}
	}

	/**
	 * Parses the body of a block whose opening brace has been consumed.
	 *
	 * @param keyToken the statement key, or {@code null} for an anonymous block inside a list
	 */
	private ScriptNode parseBlock(ParserState state, ScriptToken keyToken, String key, ScriptToken openBrace) {
		ScriptNode block;
		state.enterBlock();
		try {
			if (looksLikeList(state)) {
				block = parseListBody(state, key);
			} else {
				ContainerNode container = keyToken != null && keyToken.isType(TokenType.DATE)
						? ScriptNode.date(key, ParadoxDate.parse(key))
						: ScriptNode.object(key);
				parseObjectBody(state, container);
				block = container;
			}
		} finally {
			state.exitBlock();
		}

		if (state.check(TokenType.RIGHT_BRACE)) {
			state.advance();
		} else {
			state.log().error("Missing '}' to close '" + displayKey(key) + "' opened", openBrace);
		}
		return block;
	}

	private void parseObjectBody(ParserState state, ContainerNode container) {
		while (true) {
			state.skipComments();
			if (state.isAtEnd() || state.check(TokenType.RIGHT_BRACE)) {
				return;
			}
			ScriptNode node = parseStatement(state, true);
			if (node != null) {
				add(container, node);
			}
		}
	}

	private ListNode parseListBody(ParserState state, String key) {
		ListNode list = ScriptNode.list(key);
		while (true) {
			state.skipComments();
			if (state.isAtEnd() || state.check(TokenType.RIGHT_BRACE)) {
				return list;
			}

			ScriptToken token = state.peek();
			if (token.isType(TokenType.LEFT_BRACE)) {
				if (!skipIfTooDeep(state, "", token)) {
					state.advance(); // consume '{'
					list.addItem(parseBlock(state, null, "", token));
				}
				continue;
			}
			state.advance();
			if (token.isValue()) {
				try {
					list.addItem(ScriptNode.scalar("", toValue(token)));
				} catch (ScriptParseException e) {
					state.log().error(e.getMessage(), token);
				}
			} else {
				state.log().warning("Unexpected " + describe(token) + " in list '" + displayKey(key) + "'", token);
			}
		}
	}

	private boolean looksLikeList(ParserState state) {
		ScriptToken first = state.peekPastComments(0);
		if (!first.isType(TokenType.LEFT_BRACE) && !first.isValue()) {
			return false;
		}
		if (!first.isType(TokenType.LEFT_BRACE) && state.peekPastComments(1).isOperator()) {
			return false;
		}
		return !state.blockHasKeyedEntry();
	}

	/**
	 * Logs and skips the brace group at the cursor when opening it would exceed the nesting limit.
	 */
	private boolean skipIfTooDeep(ParserState state, String key, ScriptToken openBrace) {
		if (state.depth() < maxNestingDepth) {
			return false;
		}
		state.log().error("Maximum nesting depth (" + maxNestingDepth + ") exceeded at '" + displayKey(key) + "'", openBrace);
		skipBalancedBraces(state);
		return true;
	}

	/**
	 * Skips tokens until the next plausible statement start: an identifier or date, the end of
	 * input, or (inside a block) the closing brace of that block. Balanced brace groups are skipped
	 * as a unit.
	 */
	protected void skipToNextStatement(ParserState state, boolean insideBlock) {
		while (!state.isAtEnd()) {
			ScriptToken token = state.peek();
			if (token.isType(TokenType.IDENTIFIER) || token.isType(TokenType.DATE)) {
				return;
			}
			if (insideBlock && token.isType(TokenType.RIGHT_BRACE)) {
				return;
			}
			if (token.isType(TokenType.LEFT_BRACE)) {
				skipBalancedBraces(state);
			} else {
				state.advance();
			}
		}
	}

	private void skipBalancedBraces(ParserState state) {
		state.advance(); // consume '{'
		int depth = 1;
		while (!state.isAtEnd() && depth > 0) {
			ScriptToken token = state.advance();
			if (token.isType(TokenType.LEFT_BRACE)) {
				depth++;
			} else if (token.isType(TokenType.RIGHT_BRACE)) {
				depth--;
			}
		}
	}

	private void add(ContainerNode parent, ScriptNode child) {
		if (repeatedKeys == RepeatedKeyPolicy.ACCUMULATE) {
			parent.addChildAccumulating(child);
		} else {
			parent.addChild(child);
		}
	}

	/**
	 * Converts a value token into a scalar value.
	 *
	 * @throws ScriptParseException if a date or color token does not hold a valid literal
	 */
	protected Object toValue(ScriptToken token) {
		String text = token.value();
		return switch (token.type()) {
			case STRING -> stringCache.intern(text);
			case NUMBER -> parseNumber(text);
			case YES -> Boolean.TRUE;
			case NO -> Boolean.FALSE;
			case DATE -> ParadoxDate.parse(text);
			case COLOR -> RgbColor.tryParse(text)
					.orElseThrow(() -> new ScriptParseException("Invalid color literal: " + text));
			case IDENTIFIER -> {
				String lower = text.toLowerCase(Locale.ROOT);
				if (lower.equals("yes") || lower.equals("true")) {
					yield Boolean.TRUE;
				}
				if (lower.equals("no") || lower.equals("false")) {
					yield Boolean.FALSE;
				}
				yield stringCache.intern(text);
			}
			default -> throw new ScriptParseException("Not a value: " + describe(token));
		};
	}

	private static Object parseNumber(String text) {
		try {
			return Integer.valueOf(text);
		} catch (NumberFormatException ignored) {
			// not an int, try wider types
		}
		try {
			return Long.valueOf(text);
		} catch (NumberFormatException ignored) {
			// not a long either
		}
		if (DECIMAL.matcher(text).matches()) {
			return Double.valueOf(text);
		}
		return text;
	}

	private static String describe(ScriptToken token) {
		return switch (token.type()) {
			case EOF -> "end of input";
			case STRING -> "string \"" + token.value() + "\"";
			default -> token.type() + " '" + token.value() + "'";
		};
	}

	private static String displayKey(String key) {
		return key.isEmpty() ? "<item>" : key;
	}

	/**
	 * Cursor over the token list, shared by the parse methods of one call.
	 */
	public static class ParserState {
		protected final List<ScriptToken> tokens;
		protected final ParseLog log;
		protected int current = 0;
		protected int depth = 0;

		public ParserState(List<ScriptToken> tokens, ParseLog log) {
			if (tokens == null || tokens.isEmpty()) {
				throw new IllegalArgumentException("Token list must contain at least the EOF token");
			}
			this.tokens = tokens;
			this.log = log;
		}

		public ScriptToken peek() {
			return current < tokens.size() ? tokens.get(current) : tokens.get(tokens.size() - 1);
		}

		/**
		 * Returns the {@code n}-th token from the current position, not counting comments.
		 */
		public ScriptToken peekPastComments(int n) {
			int seen = 0;
			for (int i = current; i < tokens.size(); i++) {
				ScriptToken token = tokens.get(i);
				if (token.isType(TokenType.COMMENT)) {
					continue;
				}
				if (seen == n || token.isType(TokenType.EOF)) {
					return token;
				}
				seen++;
			}
			return tokens.get(tokens.size() - 1);
		}

		public ScriptToken advance() {
			ScriptToken token = peek();
			if (!isAtEnd()) {
				current++;
			}
			return token;
		}

		public boolean check(TokenType type) {
			return peek().type() == type;
		}

		public boolean isAtEnd() {
			return current >= tokens.size() || peek().type() == TokenType.EOF;
		}

		public void skipComments() {
			while (check(TokenType.COMMENT)) {
				advance();
			}
		}

		/**
		 * Scans from the cursor to the brace closing the current block and reports whether any entry
		 * at that level is an identifier or date followed by an operator.
		 */
		public boolean blockHasKeyedEntry() {
			int level = 0;
			for (int i = current; i < tokens.size(); i++) {
				ScriptToken token = tokens.get(i);
				if (token.isType(TokenType.EOF)) {
					return false;
				}
				if (token.isType(TokenType.LEFT_BRACE)) {
					level++;
				} else if (token.isType(TokenType.RIGHT_BRACE)) {
					if (level == 0) {
						return false;
					}
					level--;
				} else if (level == 0
						&& (token.isType(TokenType.IDENTIFIER) || token.isType(TokenType.DATE))
						&& nextSignificant(i + 1).isOperator()) {
					return true;
				}
			}
			return false;
		}

		private ScriptToken nextSignificant(int from) {
			for (int i = from; i < tokens.size(); i++) {
				if (!tokens.get(i).isType(TokenType.COMMENT)) {
					return tokens.get(i);
				}
			}
			return tokens.get(tokens.size() - 1);
		}

		public void enterBlock() {
			depth++;
		}

		public void exitBlock() {
			depth--;
		}

		/**
		 * Number of blocks currently open.
		 */
		public int depth() {
			return depth;
		}

		public ParseLog log() {
			return log;
		}

		public int getCurrentIndex() {
			return current;
		}
	}
}
