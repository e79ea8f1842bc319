package org.javai.paradox.script.io;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes script file bytes.
 * <p>
 * Detection order: UTF-8 byte order mark, UTF-16 byte order marks (little and big endian), strict
 * UTF-8, and finally the legacy charset the games save their files in. Byte order marks are never
 * part of the decoded text.
 */
public final class EncodingDetector {

	private static final Logger logger = LoggerFactory.getLogger(EncodingDetector.class);

	private final Charset legacyCharset;

	public EncodingDetector(Charset legacyCharset) {
		this.legacyCharset = Objects.requireNonNull(legacyCharset, "legacyCharset must not be null");
	}

	/**
	 * Decoded file content.
	 *
	 * @param text    the text without byte order mark
	 * @param charset the charset that decoded it
	 */
	public record DecodedText(String text, Charset charset) {
	}

	/**
	 * Decodes {@code bytes}.
	 *
	 * @throws ScriptIOException if not even the legacy charset can decode the bytes
	 */
	public DecodedText decode(byte[] bytes) throws ScriptIOException {
		if (startsWith(bytes, 0xEF, 0xBB, 0xBF)) {
			return new DecodedText(strictDecode(bytes, 3, StandardCharsets.UTF_8), StandardCharsets.UTF_8);
		}
		if (startsWith(bytes, 0xFF, 0xFE)) {
			return new DecodedText(strictDecode(bytes, 2, StandardCharsets.UTF_16LE), StandardCharsets.UTF_16LE);
		}
		if (startsWith(bytes, 0xFE, 0xFF)) {
			return new DecodedText(strictDecode(bytes, 2, StandardCharsets.UTF_16BE), StandardCharsets.UTF_16BE);
		}

		try {
			return new DecodedText(decodeOrThrow(bytes, 0, StandardCharsets.UTF_8), StandardCharsets.UTF_8);
		} catch (CharacterCodingException e) {
			logger.debug("Input is not valid UTF-8, decoding as {}", legacyCharset.name());
		}
		return new DecodedText(strictDecode(bytes, 0, legacyCharset), legacyCharset);
	}

	private static boolean startsWith(byte[] bytes, int... prefix) {
		if (bytes.length < prefix.length) {
			return false;
		}
		for (int i = 0; i < prefix.length; i++) {
			if ((bytes[i] & 0xFF) != prefix[i]) {
				return false;
			}
		}
		return true;
	}

	private static String strictDecode(byte[] bytes, int offset, Charset charset) throws ScriptIOException {
		try {
			return decodeOrThrow(bytes, offset, charset);
		} catch (CharacterCodingException e) {
			throw new ScriptIOException("Content is not valid " + charset.name(), e);
		}
	}

	private static String decodeOrThrow(byte[] bytes, int offset, Charset charset) throws CharacterCodingException {
		CharsetDecoder decoder = charset.newDecoder()
				.onMalformedInput(CodingErrorAction.REPORT)
				.onUnmappableCharacter(CodingErrorAction.REPORT);
		return decoder.decode(ByteBuffer.wrap(bytes, offset, bytes.length - offset)).toString();
	}
}
