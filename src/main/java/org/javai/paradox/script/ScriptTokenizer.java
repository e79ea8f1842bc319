package org.javai.paradox.script;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.javai.paradox.script.ScanCursor.Checkpoint;
import org.javai.paradox.script.ScriptToken.TokenType;
import org.javai.paradox.script.node.ParadoxDate;
import org.javai.paradox.script.node.RgbColor;

/**
 * Tokenizer for Paradox scripts.
 * <p>
 * Never fails: characters that cannot start a token are skipped silently. Two constructs need
 * lookahead with rollback:
 * <ul>
 *   <li>{@code { r g b }} is a single {@link TokenType#COLOR} token when it holds exactly three
 *   integers in 0..255 and no digit follows the closing brace; otherwise the brace is scanned as
 *   {@link TokenType#LEFT_BRACE}.</li>
 *   <li>{@code year.month.day} becomes a {@link TokenType#DATE} when the parts form a valid date;
 *   otherwise a number (or identifier).</li>
 * </ul>
 */
public class ScriptTokenizer {

	private final String input;

	public ScriptTokenizer(String input) {
		this.input = input != null ? input : "";
	}

	/**
	 * Tokenizes the entire input.
	 *
	 * @return the tokens, comments included, terminated by a single {@link TokenType#EOF} token
	 */
	public List<ScriptToken> tokenize() {
		ScanCursor cursor = new ScanCursor(input);
		List<ScriptToken> tokens = new ArrayList<>();

		while (true) {
			skipWhitespace(cursor);
			if (cursor.isAtEnd()) {
				break;
			}
			ScriptToken token = nextToken(cursor);
			if (token != null) {
				tokens.add(token);
			}
		}

		tokens.add(new ScriptToken(TokenType.EOF, "", cursor.line(), cursor.column(), cursor.offset()));
		return tokens;
	}

	private ScriptToken nextToken(ScanCursor cursor) {
		Checkpoint start = cursor.checkpoint();
		char c = cursor.peek();

		return switch (c) {
			case '#' -> scanComment(cursor, start);
			case '"' -> scanString(cursor, start);
			case '=' -> single(cursor, start, TokenType.EQUALS);
			case '{' -> {
				ScriptToken color = tryScanColor(cursor, start);
				yield color != null ? color : single(cursor, start, TokenType.LEFT_BRACE);
			}
			case '}' -> single(cursor, start, TokenType.RIGHT_BRACE);
			case '>' -> withOptionalEquals(cursor, start, TokenType.GREATER_THAN, TokenType.GREATER_THAN_OR_EQUAL);
			case '<' -> withOptionalEquals(cursor, start, TokenType.LESS_THAN, TokenType.LESS_THAN_OR_EQUAL);
			case '!' -> {
				cursor.advance();
				if (cursor.peek() == '=') {
					cursor.advance();
					yield token(TokenType.NOT_EQUAL, "!=", start);
				}
				// a lone '!' is not a token
				yield null;
			}
			default -> {
				if (isDigit(c) || (c == '-' && isDigit(cursor.peek(1)))) {
					yield scanNumberOrDate(cursor, start);
				}
				if (isIdentifierStart(c)) {
					yield scanIdentifierOrDate(cursor, start);
				}
				cursor.advance();
				yield null;
			}
		};
	}

	private ScriptToken scanComment(ScanCursor cursor, Checkpoint start) {
		cursor.advance(); // consume '#'
		int from = cursor.offset();
		while (!cursor.isAtEnd() && cursor.peek() != '\n') {
			cursor.advance();
		}
		return token(TokenType.COMMENT, cursor.substring(from).trim(), start);
	}

	private ScriptToken scanString(ScanCursor cursor, Checkpoint start) {
		cursor.advance(); // consume opening "

		StringBuilder sb = new StringBuilder();
		while (!cursor.isAtEnd() && cursor.peek() != '"') {
			char c = cursor.advance();
			if (c == '\\' && cursor.peek() == '"') {
				sb.append(cursor.advance());
			} else {
				sb.append(c);
			}
		}

		// an unterminated string simply runs to the end of input
		if (!cursor.isAtEnd()) {
			cursor.advance(); // consume closing "
		}
		return token(TokenType.STRING, sb.toString(), start);
	}

	private ScriptToken tryScanColor(ScanCursor cursor, Checkpoint start) {
		cursor.advance(); // consume '{'
		for (int i = 0; i < 3; i++) {
			skipWhitespace(cursor);
			if (!isDigit(cursor.peek())) {
				cursor.restore(start);
				return null;
			}
			int from = cursor.offset();
			while (isDigit(cursor.peek())) {
				cursor.advance();
			}
			String digits = cursor.substring(from);
			if (digits.length() > 3 || !RgbColor.inRange(Integer.parseInt(digits))) {
				cursor.restore(start);
				return null;
			}
		}
		skipWhitespace(cursor);
		if (cursor.peek() != '}') {
			cursor.restore(start);
			return null;
		}
		cursor.advance(); // consume '}'

		int ahead = 0;
		while (Character.isWhitespace(cursor.peek(ahead))) {
			ahead++;
		}
		if (isDigit(cursor.peek(ahead))) {
			cursor.restore(start);
			return null;
		}
		return token(TokenType.COLOR, cursor.substring(start.offset()).trim(), start);
	}

	private ScriptToken scanNumberOrDate(ScanCursor cursor, Checkpoint start) {
		if (cursor.peek() == '-') {
			cursor.advance();
		}
		while (isDigit(cursor.peek()) || cursor.peek() == '.') {
			cursor.advance();
		}
		String text = cursor.substring(start.offset());
		TokenType type = ParadoxDate.tryParse(text).isPresent() ? TokenType.DATE : TokenType.NUMBER;
		return token(type, text, start);
	}

	private ScriptToken scanIdentifierOrDate(ScanCursor cursor, Checkpoint start) {
		while (isIdentifierChar(cursor.peek())) {
			cursor.advance();
		}
		String text = cursor.substring(start.offset());

		String lower = text.toLowerCase(Locale.ROOT);
		if (lower.equals("yes")) {
			return token(TokenType.YES, text, start);
		}
		if (lower.equals("no")) {
			return token(TokenType.NO, text, start);
		}

		if (cursor.peek() == '.') {
			ScriptToken date = tryScanDateSuffix(cursor, start);
			if (date != null) {
				return date;
			}
		}
		return token(TokenType.IDENTIFIER, text, start);
	}

	private ScriptToken tryScanDateSuffix(ScanCursor cursor, Checkpoint start) {
		Checkpoint identifierEnd = cursor.checkpoint();
		cursor.advance(); // consume '.'
		while (isDigit(cursor.peek())) {
			cursor.advance();
		}
		if (cursor.peek() == '.') {
			cursor.advance();
			while (isDigit(cursor.peek())) {
				cursor.advance();
			}
			String text = cursor.substring(start.offset());
			if (ParadoxDate.tryParse(text).isPresent()) {
				return token(TokenType.DATE, text, start);
			}
		}
		cursor.restore(identifierEnd);
		return null;
	}

	private ScriptToken withOptionalEquals(ScanCursor cursor, Checkpoint start, TokenType plain, TokenType withEquals) {
		char first = cursor.advance();
		if (cursor.peek() == '=') {
			cursor.advance();
			return token(withEquals, first + "=", start);
		}
		return token(plain, String.valueOf(first), start);
	}

	private ScriptToken single(ScanCursor cursor, Checkpoint start, TokenType type) {
		char c = cursor.advance();
		return token(type, String.valueOf(c), start);
	}

	private static ScriptToken token(TokenType type, String value, Checkpoint start) {
		return new ScriptToken(type, value, start.line(), start.column(), start.offset());
	}

	private static void skipWhitespace(ScanCursor cursor) {
		while (!cursor.isAtEnd() && Character.isWhitespace(cursor.peek())) {
			cursor.advance();
		}
	}

	private static boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private static boolean isIdentifierStart(char c) {
		return Character.isLetter(c) || c == '_';
	}

	private static boolean isIdentifierChar(char c) {
		return Character.isLetterOrDigit(c) || c == '_' || c == ':';
	}
}
