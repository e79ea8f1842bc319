package org.javai.paradox.script.io;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayOutputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import org.javai.paradox.script.io.EncodingDetector.DecodedText;
import org.junit.jupiter.api.Test;

class EncodingDetectorTest {

	private static final Charset WINDOWS_1252 = Charset.forName("windows-1252");

	private final EncodingDetector detector = new EncodingDetector(WINDOWS_1252);

	@Test
	void utf8BomIsStripped() throws Exception {
		DecodedText decoded = detector.decode(withPrefix(new byte[] {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF},
				"name = \"Zürich\"".getBytes(StandardCharsets.UTF_8)));

		assertThat(decoded.charset()).isEqualTo(StandardCharsets.UTF_8);
		assertThat(decoded.text()).isEqualTo("name = \"Zürich\"");
	}

	@Test
	void utf16LittleEndianBom() throws Exception {
		DecodedText decoded = detector.decode(withPrefix(new byte[] {(byte) 0xFF, (byte) 0xFE},
				"a = 1".getBytes(StandardCharsets.UTF_16LE)));

		assertThat(decoded.charset()).isEqualTo(StandardCharsets.UTF_16LE);
		assertThat(decoded.text()).isEqualTo("a = 1");
	}

	@Test
	void utf16BigEndianBom() throws Exception {
		DecodedText decoded = detector.decode(withPrefix(new byte[] {(byte) 0xFE, (byte) 0xFF},
				"a = 1".getBytes(StandardCharsets.UTF_16BE)));

		assertThat(decoded.charset()).isEqualTo(StandardCharsets.UTF_16BE);
		assertThat(decoded.text()).isEqualTo("a = 1");
	}

	@Test
	void validUtf8WithoutBom() throws Exception {
		DecodedText decoded = detector.decode("culture = québécois".getBytes(StandardCharsets.UTF_8));

		assertThat(decoded.charset()).isEqualTo(StandardCharsets.UTF_8);
		assertThat(decoded.text()).isEqualTo("culture = québécois");
	}

	@Test
	void invalidUtf8FallsBackToLegacyCharset() throws Exception {
		DecodedText decoded = detector.decode("name = \"Château\"".getBytes(WINDOWS_1252));

		assertThat(decoded.charset()).isEqualTo(WINDOWS_1252);
		assertThat(decoded.text()).isEqualTo("name = \"Château\"");
	}

	@Test
	void bytesUndecodableByLegacyCharsetAreAnError() {
		// 0x81 is undefined in windows-1252 and not valid UTF-8 on its own
		assertThatThrownBy(() -> detector.decode(new byte[] {'a', (byte) 0x81}))
				.isInstanceOf(ScriptIOException.class)
				.hasMessageContaining("windows-1252");
	}

	@Test
	void emptyInput() throws Exception {
		assertThat(detector.decode(new byte[0]).text()).isEmpty();
	}

	private static byte[] withPrefix(byte[] prefix, byte[] body) {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		out.writeBytes(prefix);
		out.writeBytes(body);
		return out.toByteArray();
	}
}
