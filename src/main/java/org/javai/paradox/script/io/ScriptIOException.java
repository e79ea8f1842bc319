package org.javai.paradox.script.io;

/**
 * Checked exception signalling that a script file could not be read or decoded.
 */
public class ScriptIOException extends Exception {

	public ScriptIOException(String message) {
		super(message);
	}

	public ScriptIOException(String message, Throwable cause) {
		super(message, cause);
	}
}
