package org.javai.paradox.script;

/**
 * Represents a token of a Paradox script.
 *
 * @param type   the token type
 * @param value  the token text (unquoted for strings, trimmed for comments)
 * @param line   1-based line of the first character
 * @param column 1-based column of the first character
 * @param offset 0-based character offset in the input
 */
public record ScriptToken(TokenType type, String value, int line, int column, int offset) {

	public enum TokenType {
		IDENTIFIER,             // keys, tags, bare words
		STRING,                 // "quoted text"
		NUMBER,                 // 42, -1, 0.25
		DATE,                   // 1444.11.11
		YES,                    // yes (any case)
		NO,                     // no (any case)
		EQUALS,                 // =
		LEFT_BRACE,             // {
		RIGHT_BRACE,            // }
		GREATER_THAN,           // >
		LESS_THAN,              // <
		GREATER_THAN_OR_EQUAL,  // >=
		LESS_THAN_OR_EQUAL,     // <=
		NOT_EQUAL,              // !=
		COMMENT,                // # to end of line
		COLOR,                  // { r g b }
		EOF                     // end of input
	}

	public boolean isType(TokenType expectedType) {
		return this.type == expectedType;
	}

	public boolean isOperator() {
		return switch (type) {
			case EQUALS, GREATER_THAN, LESS_THAN, GREATER_THAN_OR_EQUAL, LESS_THAN_OR_EQUAL, NOT_EQUAL -> true;
			default -> false;
		};
	}

	public boolean isValue() {
		return switch (type) {
			case STRING, NUMBER, DATE, IDENTIFIER, YES, NO, COLOR -> true;
			default -> false;
		};
	}

	/**
	 * Formats the position as {@code line L, column C} for diagnostics.
	 */
	public String position() {
		return "line " + line + ", column " + column;
	}

	@Override
	public String toString() {
		return switch (type) {
			case STRING -> "STRING(\"" + value + "\") at " + line + ":" + column;
			case EOF -> "EOF at " + line + ":" + column;
			default -> type + "(" + value + ") at " + line + ":" + column;
		};
	}
}
