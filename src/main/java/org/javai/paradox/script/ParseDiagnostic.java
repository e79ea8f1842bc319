package org.javai.paradox.script;

/**
 * A message recorded while parsing.
 *
 * @param severity error or warning
 * @param message  human readable text, including the source position when known
 * @param line     1-based line, or 0 when not tied to a position
 * @param column   1-based column, or 0 when not tied to a position
 */
public record ParseDiagnostic(Severity severity, String message, int line, int column) {

	public enum Severity {
		WARNING,
		ERROR
	}

	public boolean isError() {
		return severity == Severity.ERROR;
	}

	@Override
	public String toString() {
		return severity + ": " + message;
	}
}
