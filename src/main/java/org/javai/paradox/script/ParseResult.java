package org.javai.paradox.script;

import java.util.List;
import java.util.Objects;
import org.javai.paradox.script.node.ObjectNode;

/**
 * Outcome of parsing one document in a batch.
 *
 * @param source      the file path, or the document's index for text input
 * @param root        the parsed tree; an empty root when the document could not be read
 * @param diagnostics errors and warnings of this document
 * @param metrics     snapshot of the document's metrics
 */
public record ParseResult(String source, ObjectNode root, List<ParseDiagnostic> diagnostics, ParsingMetrics metrics) {

	public ParseResult {
		Objects.requireNonNull(source, "source must not be null");
		Objects.requireNonNull(root, "root must not be null");
		diagnostics = List.copyOf(diagnostics);
		Objects.requireNonNull(metrics, "metrics must not be null");
	}

	public List<String> errors() {
		return diagnostics.stream().filter(ParseDiagnostic::isError).map(ParseDiagnostic::message).toList();
	}

	public List<String> warnings() {
		return diagnostics.stream().filter(d -> !d.isError()).map(ParseDiagnostic::message).toList();
	}

	public boolean hasErrors() {
		return diagnostics.stream().anyMatch(ParseDiagnostic::isError);
	}
}
