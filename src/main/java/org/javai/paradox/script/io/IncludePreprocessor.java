package org.javai.paradox.script.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import org.javai.paradox.script.ParseLog;
import org.javai.paradox.script.ParserOptions;
import org.javai.paradox.script.ParsingMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands {@code @include} directives.
 * <p>
 * A line whose trimmed text starts with {@code @include} (any case) names a file, quoted or bare.
 * The line is replaced by the file's content, itself expanded, framed by
 * {@code # Included from: path} and {@code # End include: path} comment lines. Relative paths
 * resolve against the directory of the including file.
 * <p>
 * Failures do not abort: a missing file, a cycle or an include nested deeper than
 * {@link ParserOptions#maxIncludeDepth()} is logged as an error and expands to nothing.
 */
public final class IncludePreprocessor {

	private static final Logger logger = LoggerFactory.getLogger(IncludePreprocessor.class);

	static final String DIRECTIVE = "@include";
	public static final String INCLUDES_PROCESSED = "IncludesProcessed";

	private final ParserOptions options;
	private final ParseLog log;
	private final ParsingMetrics metrics;
	private final EncodingDetector encodingDetector;
	private final Deque<Path> includeStack = new ArrayDeque<>();

	public IncludePreprocessor(ParserOptions options, ParseLog log, ParsingMetrics metrics) {
		this.options = options;
		this.log = log;
		this.metrics = metrics;
		this.encodingDetector = new EncodingDetector(options.legacyCharset());
	}

	/**
	 * Expands the includes of {@code content}, which was read from {@code file}.
	 */
	public String process(String content, Path file) {
		Path root = canonical(file);
		includeStack.push(root);
		try {
			return expand(content, root);
		} finally {
			includeStack.pop();
		}
	}

	private String expand(String content, Path currentFile) {
		StringBuilder result = new StringBuilder(content.length());
		int start = 0;
		while (start < content.length()) {
			int newline = content.indexOf('\n', start);
			int end = newline < 0 ? content.length() : newline + 1;
			String line = content.substring(start, end);
			start = end;

			String trimmed = line.trim();
			if (!isDirective(trimmed)) {
				result.append(line);
				continue;
			}

			String includePath = stripQuotes(trimmed.substring(DIRECTIVE.length()).trim());
			if (includePath.isEmpty()) {
				log.warning("Empty include path in directive: " + trimmed);
				result.append(line);
				continue;
			}

			String included = include(includePath, currentFile);
			result.append("# Included from: ").append(includePath).append('\n');
			result.append(included);
			if (!included.isEmpty() && !included.endsWith("\n")) {
				result.append('\n');
			}
			result.append("# End include: ").append(includePath).append(lineEnding(line));
		}
		return result.toString();
	}

	private static String lineEnding(String line) {
		if (line.endsWith("\r\n")) {
			return "\r\n";
		}
		return line.endsWith("\n") ? "\n" : "";
	}

	private String include(String includePath, Path currentFile) {
		Path resolved = resolve(includePath, currentFile);

		if (includeStack.contains(resolved)) {
			fail("Circular include detected: " + resolved);
			return "";
		}
		if (includeStack.size() - 1 >= options.maxIncludeDepth()) {
			fail("Maximum include depth (" + options.maxIncludeDepth() + ") exceeded including " + resolved);
			return "";
		}
		if (!Files.isRegularFile(resolved)) {
			fail("Include file not found: " + resolved);
			return "";
		}

		includeStack.push(resolved);
		metrics.increment(INCLUDES_PROCESSED);
		long start = System.nanoTime();
		try {
			String content = encodingDetector.decode(Files.readAllBytes(resolved)).text();
			return expand(content, resolved);
		} catch (IOException | ScriptIOException e) {
			fail("Error processing include '" + includePath + "': " + e.getMessage());
			return "";
		} finally {
			includeStack.pop();
			metrics.recordTiming("Include_" + resolved.getFileName(), Duration.ofNanos(System.nanoTime() - start));
		}
	}

	private void fail(String message) {
		logger.warn(message);
		log.error(message);
	}

	static boolean isDirective(String trimmedLine) {
		return trimmedLine.regionMatches(true, 0, DIRECTIVE, 0, DIRECTIVE.length())
				&& (trimmedLine.length() == DIRECTIVE.length()
				|| !Character.isLetterOrDigit(trimmedLine.charAt(DIRECTIVE.length())));
	}

	private static String stripQuotes(String text) {
		int start = 0;
		int end = text.length();
		while (start < end && isQuote(text.charAt(start))) {
			start++;
		}
		while (end > start && isQuote(text.charAt(end - 1))) {
			end--;
		}
		return text.substring(start, end);
	}

	private static boolean isQuote(char c) {
		return c == '"' || c == '\'';
	}

	private static Path resolve(String includePath, Path currentFile) {
		Path target = Path.of(includePath);
		if (target.isAbsolute()) {
			return target.normalize();
		}
		Path directory = currentFile.getParent();
		return canonical(directory != null ? directory.resolve(target) : target);
	}

	private static Path canonical(Path path) {
		return path.toAbsolutePath().normalize();
	}
}
