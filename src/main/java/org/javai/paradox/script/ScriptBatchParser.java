package org.javai.paradox.script;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Supplier;
import org.javai.paradox.script.ParseDiagnostic.Severity;
import org.javai.paradox.script.io.ScriptIOException;
import org.javai.paradox.script.node.ObjectNode;
import org.javai.paradox.script.node.ScriptNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses independent documents concurrently.
 * <p>
 * Each document gets its own {@link ScriptParser}, so logs and metrics never mix. Results are
 * returned in input order. A file that cannot be read yields a result with an empty root and a
 * single error instead of failing the batch.
 */
public final class ScriptBatchParser implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(ScriptBatchParser.class);

	private final ExecutorService executor;
	private final boolean ownsExecutor;
	private final Supplier<ScriptParser> parserFactory;
	private boolean closed = false;

	/**
	 * Creates a batch parser with its own pool of {@code threads} daemon threads.
	 */
	public ScriptBatchParser(ParserOptions options, int threads) {
		this(Executors.newFixedThreadPool(Math.max(threads, 1), r -> {
			Thread t = new Thread(r, "script-batch-parser");
			t.setDaemon(true);
			return t;
		}), true, () -> new ScriptParser(options));
	}

	/**
	 * Creates a batch parser on a caller-managed executor; {@link #close()} leaves it running.
	 */
	public ScriptBatchParser(ExecutorService executor, Supplier<ScriptParser> parserFactory) {
		this(executor, false, parserFactory);
	}

	private ScriptBatchParser(ExecutorService executor, boolean ownsExecutor, Supplier<ScriptParser> parserFactory) {
		if (executor == null) {
			throw new IllegalArgumentException("Executor cannot be null");
		}
		if (parserFactory == null) {
			throw new IllegalArgumentException("Parser factory cannot be null");
		}
		this.executor = executor;
		this.ownsExecutor = ownsExecutor;
		this.parserFactory = parserFactory;
	}

	/**
	 * Parses script texts; the source of each result is its index in {@code documents}.
	 */
	public List<ParseResult> parseAll(List<String> documents) {
		List<Callable<ParseResult>> tasks = new ArrayList<>();
		for (int i = 0; i < documents.size(); i++) {
			String source = String.valueOf(i);
			String text = documents.get(i);
			tasks.add(() -> {
				ScriptParser parser = parserFactory.get();
				ObjectNode root = parser.parse(text);
				return new ParseResult(source, root, parser.diagnostics(), parser.metrics().snapshot());
			});
		}
		return runAll(tasks);
	}

	public List<ParseResult> parseFiles(List<Path> paths) {
		List<Callable<ParseResult>> tasks = new ArrayList<>();
		for (Path path : paths) {
			tasks.add(() -> parseFile(path));
		}
		return runAll(tasks);
	}

	private ParseResult parseFile(Path path) {
		ScriptParser parser = parserFactory.get();
		try {
			ObjectNode root = parser.parseFile(path);
			return new ParseResult(path.toString(), root, parser.diagnostics(), parser.metrics().snapshot());
		} catch (ScriptIOException e) {
			logger.warn("Could not read {}: {}", path, e.getMessage());
			ParseDiagnostic failure = new ParseDiagnostic(Severity.ERROR, e.getMessage(), 0, 0);
			return new ParseResult(path.toString(), ScriptNode.root(), List.of(failure), new ParsingMetrics());
		}
	}

	private List<ParseResult> runAll(List<Callable<ParseResult>> tasks) {
		if (closed) {
			throw new IllegalStateException("Batch parser is closed");
		}
		List<Future<ParseResult>> futures = new ArrayList<>();
		for (Callable<ParseResult> task : tasks) {
			futures.add(executor.submit(task));
		}

		List<ParseResult> results = new ArrayList<>(futures.size());
		for (Future<ParseResult> future : futures) {
			try {
				results.add(future.get());
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				futures.forEach(f -> f.cancel(true));
				throw new IllegalStateException("Interrupted while waiting for batch results", e);
			} catch (ExecutionException e) {
				throw new IllegalStateException("Failed to parse document", e.getCause());
			}
		}
		logger.debug("Parsed batch of {} documents", results.size());
		return results;
	}

	@Override
	public void close() {
		if (!closed) {
			closed = true;
			if (ownsExecutor) {
				executor.shutdown();
			}
		}
	}
}
