package org.javai.paradox.script;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.javai.paradox.script.ParseDiagnostic.Severity;

/**
 * Errors and warnings collected during one parse call.
 * <p>
 * Owned by a single {@link ScriptParser} and cleared at the start of every parse; never shared
 * between threads.
 */
public final class ParseLog {

	private final List<ParseDiagnostic> diagnostics = new ArrayList<>();

	public void error(String message) {
		diagnostics.add(new ParseDiagnostic(Severity.ERROR, message, 0, 0));
	}

	public void error(String message, ScriptToken at) {
		diagnostics.add(new ParseDiagnostic(Severity.ERROR, message + " at " + at.position(), at.line(), at.column()));
	}

	public void warning(String message) {
		diagnostics.add(new ParseDiagnostic(Severity.WARNING, message, 0, 0));
	}

	public void warning(String message, ScriptToken at) {
		diagnostics.add(new ParseDiagnostic(Severity.WARNING, message + " at " + at.position(), at.line(), at.column()));
	}

	public List<ParseDiagnostic> diagnostics() {
		return Collections.unmodifiableList(diagnostics);
	}

	public List<String> errors() {
		return messages(Severity.ERROR);
	}

	public List<String> warnings() {
		return messages(Severity.WARNING);
	}

	public int errorCount() {
		return (int) diagnostics.stream().filter(ParseDiagnostic::isError).count();
	}

	public int warningCount() {
		return diagnostics.size() - errorCount();
	}

	public boolean hasErrors() {
		return errorCount() > 0;
	}

	public void clear() {
		diagnostics.clear();
	}

	private List<String> messages(Severity severity) {
		return diagnostics.stream()
				.filter(d -> d.severity() == severity)
				.map(ParseDiagnostic::message)
				.toList();
	}
}
