package org.javai.paradox.script;

/**
 * Character cursor used by {@link ScriptTokenizer}. Tracks offset, line and column together so that
 * speculative scans can be rolled back atomically with {@link #checkpoint()} / {@link #restore}.
 */
final class ScanCursor {

	/**
	 * Saved cursor state.
	 */
	record Checkpoint(int offset, int line, int column) {
	}

	private final String input;
	private int offset;
	private int line = 1;
	private int column = 1;

	ScanCursor(String input) {
		this.input = input;
	}

	Checkpoint checkpoint() {
		return new Checkpoint(offset, line, column);
	}

	void restore(Checkpoint checkpoint) {
		this.offset = checkpoint.offset();
		this.line = checkpoint.line();
		this.column = checkpoint.column();
	}

	boolean isAtEnd() {
		return offset >= input.length();
	}

	char peek() {
		return isAtEnd() ? '\0' : input.charAt(offset);
	}

	char peek(int ahead) {
		int index = offset + ahead;
		return index < input.length() ? input.charAt(index) : '\0';
	}

	char advance() {
		char c = input.charAt(offset++);
		if (c == '\n') {
			line++;
			column = 1;
		} else {
			column++;
		}
		return c;
	}

	String substring(int from) {
		return input.substring(from, offset);
	}

	int offset() {
		return offset;
	}

	int line() {
		return line;
	}

	int column() {
		return column;
	}
}
