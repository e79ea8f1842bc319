package org.javai.paradox.script.io;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import org.javai.paradox.script.ParseLog;
import org.javai.paradox.script.ParserOptions;
import org.javai.paradox.script.ParsingMetrics;

/**
 * Loads a script file into text: reads the bytes, detects the encoding and, unless disabled,
 * expands {@code @include} directives. Include problems go to the {@link ParseLog}.
 */
public final class ScriptFileReader {

	private final ParserOptions options;
	private final ParseLog log;
	private final ParsingMetrics metrics;

	public ScriptFileReader(ParserOptions options, ParseLog log, ParsingMetrics metrics) {
		this.options = options;
		this.log = log;
		this.metrics = metrics;
	}

	/**
	 * @param text      decoded and include-expanded text
	 * @param charset   charset the root file was decoded with
	 * @param sizeBytes size of the root file
	 */
	public record LoadedScript(String text, Charset charset, long sizeBytes) {
	}

	public LoadedScript read(Path path) throws ScriptIOException {
		if (path == null) {
			throw new IllegalArgumentException("Path cannot be null");
		}
		if (!Files.exists(path)) {
			throw new ScriptFileNotFoundException(path);
		}

		byte[] bytes;
		try {
			bytes = Files.readAllBytes(path);
		} catch (IOException e) {
			throw new ScriptIOException("Could not read " + path + ": " + e.getMessage(), e);
		}

		EncodingDetector.DecodedText decoded;
		try {
			decoded = new EncodingDetector(options.legacyCharset()).decode(bytes);
		} catch (ScriptIOException e) {
			throw new ScriptIOException("Could not decode " + path + ": " + e.getMessage(), e);
		}
		String text = decoded.text();
		if (options.includesEnabled()) {
			text = new IncludePreprocessor(options, log, metrics).process(text, path);
		}
		return new LoadedScript(text, decoded.charset(), bytes.length);
	}
}
