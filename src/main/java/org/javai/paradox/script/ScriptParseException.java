package org.javai.paradox.script;

/**
 * Exception thrown when script content cannot be interpreted.
 * <p>
 * Content errors are normally recorded in the {@link ParseLog}; this exception only escapes a
 * {@link ParsingStrategy} for conditions it cannot recover from, and {@link ScriptParser} turns it
 * into a logged error.
 */
public class ScriptParseException extends RuntimeException {

	public ScriptParseException(String message) {
		super(message);
	}

	public ScriptParseException(String message, Throwable cause) {
		super(message, cause);
	}
}
