package org.javai.paradox.script;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Counters and timings of a single parse call. Reset by {@link ScriptParser} at the start of every
 * call and readable after it returns, whether or not the input had errors.
 */
public final class ParsingMetrics {

	private Duration tokenizationTime = Duration.ZERO;
	private Duration parsingTime = Duration.ZERO;
	private Duration fileIoTime = Duration.ZERO;
	private int tokensProcessed;
	private int linesProcessed;
	private long inputSizeBytes;
	private int errorCount;
	private int warningCount;
	private final Map<String, Duration> timings = new LinkedHashMap<>();
	private final Map<String, Integer> counters = new LinkedHashMap<>();

	public void reset() {
		tokenizationTime = Duration.ZERO;
		parsingTime = Duration.ZERO;
		fileIoTime = Duration.ZERO;
		tokensProcessed = 0;
		linesProcessed = 0;
		inputSizeBytes = 0;
		errorCount = 0;
		warningCount = 0;
		timings.clear();
		counters.clear();
	}

	/**
	 * Independent copy, safe to hand out after the owning parser moves on to the next call.
	 */
	public ParsingMetrics snapshot() {
		ParsingMetrics copy = new ParsingMetrics();
		copy.tokenizationTime = tokenizationTime;
		copy.parsingTime = parsingTime;
		copy.fileIoTime = fileIoTime;
		copy.tokensProcessed = tokensProcessed;
		copy.linesProcessed = linesProcessed;
		copy.inputSizeBytes = inputSizeBytes;
		copy.errorCount = errorCount;
		copy.warningCount = warningCount;
		copy.timings.putAll(timings);
		copy.counters.putAll(counters);
		return copy;
	}

	public void recordTiming(String name, Duration elapsed) {
		timings.put(name, elapsed);
	}

	public void increment(String counter) {
		counters.merge(counter, 1, Integer::sum);
	}

	public int counter(String counter) {
		return counters.getOrDefault(counter, 0);
	}

	public Map<String, Duration> timings() {
		return Collections.unmodifiableMap(timings);
	}

	public Map<String, Integer> counters() {
		return Collections.unmodifiableMap(counters);
	}

	public Duration totalParsingTime() {
		return tokenizationTime.plus(parsingTime);
	}

	public Duration totalTime() {
		return totalParsingTime().plus(fileIoTime);
	}

	public double tokensPerSecond() {
		double seconds = Math.max(totalParsingTime().toNanos() / 1_000_000_000.0, 0.001);
		return tokensProcessed / seconds;
	}

	public Duration tokenizationTime() {
		return tokenizationTime;
	}

	void setTokenizationTime(Duration tokenizationTime) {
		this.tokenizationTime = tokenizationTime;
	}

	public Duration parsingTime() {
		return parsingTime;
	}

	void setParsingTime(Duration parsingTime) {
		this.parsingTime = parsingTime;
	}

	public Duration fileIoTime() {
		return fileIoTime;
	}

	void setFileIoTime(Duration fileIoTime) {
		this.fileIoTime = fileIoTime;
	}

	public int tokensProcessed() {
		return tokensProcessed;
	}

	void setTokensProcessed(int tokensProcessed) {
		this.tokensProcessed = tokensProcessed;
	}

	public int linesProcessed() {
		return linesProcessed;
	}

	void setLinesProcessed(int linesProcessed) {
		this.linesProcessed = linesProcessed;
	}

	public long inputSizeBytes() {
		return inputSizeBytes;
	}

	void setInputSizeBytes(long inputSizeBytes) {
		this.inputSizeBytes = inputSizeBytes;
	}

	public int errorCount() {
		return errorCount;
	}

	public int warningCount() {
		return warningCount;
	}

	void setCounts(int errorCount, int warningCount) {
		this.errorCount = errorCount;
		this.warningCount = warningCount;
	}

	@Override
	public String toString() {
		return String.format(Locale.ROOT,
				"Parsing metrics: total %.1fms, tokens %d, throughput %.0f tokens/sec, errors %d, warnings %d",
				totalTime().toNanos() / 1_000_000.0, tokensProcessed, tokensPerSecond(), errorCount, warningCount);
	}
}
