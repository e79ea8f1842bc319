package org.javai.paradox.script;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.javai.paradox.script.io.ScriptFileReader;
import org.javai.paradox.script.io.ScriptFileReader.LoadedScript;
import org.javai.paradox.script.io.ScriptIOException;
import org.javai.paradox.script.node.ObjectNode;
import org.javai.paradox.script.node.ScriptNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Paradox script parser with pluggable parsing strategies.
 * <p>
 * By default, uses {@link GenericParsingStrategy} which accepts any syntactically correct script.
 * Every call to {@link #parse(String)} or {@link #parseFile(Path)} starts with an empty
 * {@link ParseLog} and fresh {@link ParsingMetrics}; both stay readable until the next call.
 * Content errors never throw: they are recorded in the log and the parse continues, so the result
 * is always a root node, possibly partial.
 * <p>
 * Example usage:
 *
 * <pre>
 * ScriptParser parser = new ScriptParser();
 * ObjectNode root = parser.parse("owner = FRA\ncontroller = FRA");
 * String owner = root.getString("owner");
 *
 * // File input, with encoding detection and include expansion
 * ObjectNode country = parser.parseFile(Path.of("history/countries/FRA - France.txt"));
 * parser.errors().forEach(System.err::println);
 * </pre>
 * <p>
 * Instances are not thread-safe; use one parser per thread (see {@link ScriptBatchParser}).
 */
public class ScriptParser {

	private static final Logger logger = LoggerFactory.getLogger(ScriptParser.class);

	private final ParsingStrategy strategy;
	private final ParserOptions options;
	private final ParseLog log = new ParseLog();
	private final ParsingMetrics metrics = new ParsingMetrics();

	/**
	 * Creates a parser with the generic strategy and default options.
	 */
	public ScriptParser() {
		this(ParserOptions.defaults());
	}

	public ScriptParser(ParserOptions options) {
		this(new GenericParsingStrategy(options), options);
	}

	public ScriptParser(ParsingStrategy strategy) {
		this(strategy, ParserOptions.defaults());
	}

	/**
	 * Creates a parser with an explicit parsing strategy.
	 *
	 * @param strategy the parsing strategy to use
	 * @param options  options for file input
	 */
	public ScriptParser(ParsingStrategy strategy, ParserOptions options) {
		if (strategy == null) {
			throw new IllegalArgumentException("Parsing strategy cannot be null");
		}
		if (options == null) {
			throw new IllegalArgumentException("Parser options cannot be null");
		}
		this.strategy = strategy;
		this.options = options;
	}

	/**
	 * Parses script text.
	 *
	 * @param text the script; {@code null} is treated as empty
	 * @return the root node, never {@code null}
	 */
	public ObjectNode parse(String text) {
		reset();
		String source = text != null ? text : "";
		metrics.setInputSizeBytes(source.getBytes(StandardCharsets.UTF_8).length);
		return parseText(source, "<text>");
	}

	/**
	 * Reads, decodes and parses a script file, expanding {@code @include} directives unless disabled
	 * in the options. Include failures are recorded as errors, not thrown.
	 *
	 * @param path the file to parse
	 * @return the root node, never {@code null}
	 * @throws ScriptIOException if the file does not exist, cannot be read or cannot be decoded
	 */
	public ObjectNode parseFile(Path path) throws ScriptIOException {
		reset();
		long start = System.nanoTime();
		LoadedScript loaded = new ScriptFileReader(options, log, metrics).read(path);
		metrics.setFileIoTime(Duration.ofNanos(System.nanoTime() - start));
		metrics.setInputSizeBytes(loaded.sizeBytes());
		return parseText(loaded.text(), path.toString());
	}

	private ObjectNode parseText(String text, String source) {
		ObjectNode root;
		try {
			long start = System.nanoTime();
			List<ScriptToken> tokens = new ScriptTokenizer(text).tokenize();
			metrics.setTokenizationTime(Duration.ofNanos(System.nanoTime() - start));
			metrics.setTokensProcessed(tokens.size() - 1);
			metrics.setLinesProcessed(countLines(text));

			start = System.nanoTime();
			root = strategy.parse(tokens, log);
			metrics.setParsingTime(Duration.ofNanos(System.nanoTime() - start));
		} catch (ScriptParseException e) {
			log.error(e.getMessage());
			root = ScriptNode.root();
		} catch (RuntimeException e) {
			logger.error("Parsing {} failed unexpectedly", source, e);
			log.error("Unexpected parser failure: " + e.getMessage());
			root = ScriptNode.root();
		}

		metrics.setCounts(log.errorCount(), log.warningCount());
		if (logger.isDebugEnabled()) {
			logger.debug("Parsed {}: {} top-level entries, {}", source, root.size(), metrics);
		}
		return root;
	}

	private void reset() {
		log.clear();
		metrics.reset();
	}

	private static int countLines(String text) {
		if (text.isEmpty()) {
			return 0;
		}
		int lines = 1;
		for (int i = 0; i < text.length(); i++) {
			if (text.charAt(i) == '\n') {
				lines++;
			}
		}
		return lines;
	}

	public List<String> errors() {
		return log.errors();
	}

	public List<String> warnings() {
		return log.warnings();
	}

	public List<ParseDiagnostic> diagnostics() {
		return log.diagnostics();
	}

	public boolean hasErrors() {
		return log.hasErrors();
	}

	/**
	 * Metrics of the last call. The instance is reused; take a {@link ParsingMetrics#snapshot()} to
	 * keep values across calls.
	 */
	public ParsingMetrics metrics() {
		return metrics;
	}

	public ParserOptions options() {
		return options;
	}
}
