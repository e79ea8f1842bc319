package org.javai.paradox.script;

import java.nio.charset.Charset;
import java.util.Objects;

/**
 * Configuration for {@link ScriptParser}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Use defaults
 * ScriptParser parser = new ScriptParser(ParserOptions.defaults());
 *
 * // Custom configuration
 * ParserOptions options = ParserOptions.builder()
 *         .maxIncludeDepth(4)
 *         .maxNestingDepth(64)
 *         .repeatedKeys(RepeatedKeyPolicy.ACCUMULATE)
 *         .stringCache(new InterningStringCache())
 *         .build();
 * }</pre>
 *
 * @param maxIncludeDepth  how many {@code @include} directives may be nested
 * @param maxNestingDepth  how many blocks may be open at once; deeper blocks are skipped
 * @param includesEnabled  whether file parsing expands {@code @include} directives
 * @param legacyCharset    charset used for files that are neither BOM-marked nor valid UTF-8
 * @param repeatedKeys     how statements repeating a key are stored
 * @param stringCache      canonicalizes keys and identifier values
 */
public record ParserOptions(
		int maxIncludeDepth,
		int maxNestingDepth,
		boolean includesEnabled,
		Charset legacyCharset,
		RepeatedKeyPolicy repeatedKeys,
		StringCache stringCache
) {

	public static final int DEFAULT_MAX_INCLUDE_DEPTH = 10;
	public static final int DEFAULT_MAX_NESTING_DEPTH = 256;

	/**
	 * Code page the games historically save their text files in.
	 */
	public static final String DEFAULT_LEGACY_CHARSET = "windows-1252";

	/**
	 * Storage of statements that repeat a key under the same parent.
	 */
	public enum RepeatedKeyPolicy {
		/** The last statement wins. */
		OVERWRITE,
		/** All statements are kept, as a list node. */
		ACCUMULATE
	}

	public ParserOptions {
		if (maxIncludeDepth < 0) {
			throw new IllegalArgumentException("maxIncludeDepth must be non-negative");
		}
		if (maxNestingDepth < 1) {
			throw new IllegalArgumentException("maxNestingDepth must be positive");
		}
		Objects.requireNonNull(legacyCharset, "legacyCharset must not be null");
		Objects.requireNonNull(repeatedKeys, "repeatedKeys must not be null");
		Objects.requireNonNull(stringCache, "stringCache must not be null");
	}

	public static ParserOptions defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Builder for {@link ParserOptions}.
	 */
	public static class Builder {
		private int maxIncludeDepth = DEFAULT_MAX_INCLUDE_DEPTH;
		private int maxNestingDepth = DEFAULT_MAX_NESTING_DEPTH;
		private boolean includesEnabled = true;
		private Charset legacyCharset = Charset.forName(DEFAULT_LEGACY_CHARSET);
		private RepeatedKeyPolicy repeatedKeys = RepeatedKeyPolicy.OVERWRITE;
		private StringCache stringCache = StringCache.NONE;

		private Builder() {}

		public Builder maxIncludeDepth(int maxIncludeDepth) {
			this.maxIncludeDepth = maxIncludeDepth;
			return this;
		}

		public Builder maxNestingDepth(int maxNestingDepth) {
			this.maxNestingDepth = maxNestingDepth;
			return this;
		}

		public Builder includesEnabled(boolean includesEnabled) {
			this.includesEnabled = includesEnabled;
			return this;
		}

		public Builder legacyCharset(Charset legacyCharset) {
			this.legacyCharset = legacyCharset;
			return this;
		}

		public Builder repeatedKeys(RepeatedKeyPolicy repeatedKeys) {
			this.repeatedKeys = repeatedKeys;
			return this;
		}

		public Builder stringCache(StringCache stringCache) {
			this.stringCache = stringCache;
			return this;
		}

		public ParserOptions build() {
			return new ParserOptions(maxIncludeDepth, maxNestingDepth, includesEnabled, legacyCharset, repeatedKeys, stringCache);
		}
	}
}
